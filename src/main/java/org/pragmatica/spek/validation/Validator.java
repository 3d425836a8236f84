package org.pragmatica.spek.validation;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.apache.log4j.Logger;
import org.pragmatica.spek.error.CompileError;
import org.pragmatica.spek.error.CompileError.ValidationFailure;
import org.pragmatica.spek.error.Diagnostic;
import org.pragmatica.spek.error.Stage;
import org.pragmatica.spek.syntax.Expression;
import org.pragmatica.spek.syntax.SourceModule;
import org.pragmatica.spek.syntax.Statement;
import org.pragmatica.spek.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static semantic checks over a parsed module. All problems are collected before the pass fails.
 */
public final class Validator {
    private static final Logger logger = Logger.getLogger(Validator.class);

    /**
     * Exception types every module can raise and catch; all of them are kinds of {@code Exception}.
     */
    public static final Set<String> EXCEPTION_TYPES = Set.of("Exception", "RuntimeError", "TypeError", "ValueError",
                                                             "IndexError", "KeyError", "AttributeError",
                                                             "ZeroDivisionError", "OverflowError",
                                                             "RecursionError");

    /**
     * Names of the functions every module can call without declaring them.
     */
    public static final Set<String> BUILTINS = builtins();

    private static final String SELF = "self";

    private final SourceModule module;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final IdentityHashMap<Object, Symbol> bindings = new IdentityHashMap<>();
    private final Map<String, ClassShape> classes = new LinkedHashMap<>();
    private final Map<String, Statement.FunctionDeclaration> functions = new HashMap<>();
    private final Map<String, Statement.PropertyDeclaration> properties = new HashMap<>();
    private final Set<String> brokenHierarchies = new HashSet<>();
    private final Set<String> suspendingFunctions = new HashSet<>();
    private final Set<String> suspendingMethods = new HashSet<>();
    private final Scope moduleScope;

    private Validator(SourceModule module) {
        this.module = module;
        var builtins = Scope.root();
        BUILTINS.forEach(name -> builtins.declare(Symbol.builtin(name)));
        this.moduleScope = builtins.child(false);
    }

    private static Set<String> builtins() {
        var names = new HashSet<>(Set.of("len", "str", "int", "float", "abs", "min", "max", "range", "now",
                                         "tuple", "isinstance"));
        names.addAll(EXCEPTION_TYPES);
        return Set.copyOf(names);
    }

    public static Either<CompileError, ValidatedModule> validate(SourceModule module) {
        return new Validator(module).run();
    }

    private Either<CompileError, ValidatedModule> run() {
        hoistDeclarations();
        checkHierarchies();
        collectSuspensions();

        var script = new Context(moduleScope, Option.none(), BodyKind.SCRIPT, SourceSpan.NONE);
        for (var statement : module.statements()) {
            validateStatement(statement, script, true);
        }

        if (!diagnostics.isEmpty()) {
            diagnostics.sort(Comparator.comparingInt(d -> d.span().start().offset()));
            logger.debug("Validation failed with " + diagnostics.size() + " diagnostic(s)");
            return Either.left(new ValidationFailure(diagnostics));
        }
        logger.debug("Validated module: " + functions.size() + " function(s), " + classes.size() + " class(es)");
        return Either.right(new ValidatedModule(module, bindings, classes, suspendingFunctions, suspendingMethods));
    }

    // === Module-level declarations ===

    private void hoistDeclarations() {
        for (var statement : module.statements()) {
            if (statement instanceof Statement.FunctionDeclaration function) {
                if (declareHoisted(new Symbol(Symbol.Kind.FUNCTION, function.name(), function.span()))) {
                    functions.put(function.name(), function);
                }
            } else if (statement instanceof Statement.ClassDeclaration declaration) {
                if (declareHoisted(new Symbol(Symbol.Kind.CLASS, declaration.name(), declaration.span()))) {
                    var shape = ClassShape.of(declaration);
                    classes.put(declaration.name(), shape);
                    checkMembers(declaration, shape);
                }
            } else if (statement instanceof Statement.PropertyDeclaration property) {
                if (declareHoisted(new Symbol(Symbol.Kind.PROPERTY, property.name(), property.span()))) {
                    properties.put(property.name(), property);
                }
            }
        }
    }

    private boolean declareHoisted(Symbol symbol) {
        if (moduleScope.declared(symbol.name()).isDefined()) {
            duplicate(symbol.name(), symbol.declaration());
            return false;
        }
        moduleScope.declare(symbol);
        return true;
    }

    private void checkMembers(Statement.ClassDeclaration declaration, ClassShape shape) {
        var seen = new HashSet<String>();
        var delegated = new HashSet<String>();
        for (var member : declaration.members()) {
            if (member instanceof Statement.VarDeclaration field) {
                memberName(seen, field.name(), field.span());
            } else if (member instanceof Statement.FunctionDeclaration method) {
                memberName(seen, method.name(), method.span());
            } else if (member instanceof Statement.PropertyDeclaration property) {
                memberName(seen, property.name(), property.span());
            } else if (member instanceof Statement.DelegateDeclaration delegate) {
                if (!shape.fields().containsKey(delegate.field())) {
                    report(DiagnosticCode.INVALID_DELEGATE,
                           "delegate '" + delegate.field() + "' does not name a field of class '" + declaration.name() + "'",
                           delegate.span());
                } else if (!delegated.add(delegate.field())) {
                    report(DiagnosticCode.INVALID_DELEGATE,
                           "field '" + delegate.field() + "' is delegated to more than once",
                           delegate.span());
                }
            }
        }
    }

    private void memberName(Set<String> seen, String name, SourceSpan span) {
        if (!seen.add(name)) {
            duplicate(name, span);
        }
    }

    private void checkHierarchies() {
        for (var shape : classes.values()) {
            var superclass = shape.superclass();
            if (superclass.isDefined() && !classes.containsKey(superclass.get())) {
                report(DiagnosticCode.UNKNOWN_SUPERCLASS,
                       "unknown superclass '" + superclass.get() + "' of class '" + shape.name() + "'",
                       shape.declaration().span());
                brokenHierarchies.add(shape.name());
            }
        }
        for (var shape : classes.values()) {
            var seen = new HashSet<String>();
            var current = Option.of(shape);
            while (current.isDefined()) {
                if (!seen.add(current.get().name())) {
                    if (current.get().name().equals(shape.name())) {
                        report(DiagnosticCode.INHERITANCE_CYCLE,
                               "class '" + shape.name() + "' inherits from itself",
                               shape.declaration().span());
                    }
                    brokenHierarchies.add(shape.name());
                    break;
                }
                if (brokenHierarchies.contains(current.get().name())) {
                    brokenHierarchies.add(shape.name());
                }
                current = current.get()
                                 .superclass()
                                 .flatMap(name -> Option.of(classes.get(name)));
            }
        }
    }

    private void collectSuspensions() {
        functions.forEach((name, function) -> {
            if (containsAwait(function.body())) {
                suspendingFunctions.add(name);
            }
        });
        for (var shape : classes.values()) {
            shape.methods().forEach((name, method) -> {
                if (containsAwait(method.body())) {
                    suspendingMethods.add(shape.name() + "." + name);
                }
            });
        }
    }

    private static boolean containsAwait(List<Statement> body) {
        for (var statement : body) {
            if (statement instanceof Statement.Await) {
                return true;
            }
            if (statement instanceof Statement.If conditional
                && (containsAwait(conditional.thenBranch()) || containsAwait(conditional.elseBranch()))) {
                return true;
            }
            if (statement instanceof Statement.While loop && containsAwait(loop.body())) {
                return true;
            }
            if (statement instanceof Statement.For loop && containsAwait(loop.body())) {
                return true;
            }
            if (statement instanceof Statement.Try attempt && containsAwait(attempt)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAwait(Statement.Try attempt) {
        if (containsAwait(attempt.body()) || attempt.finallyBody().exists(Validator::containsAwait)) {
            return true;
        }
        return attempt.handlers().stream().anyMatch(handler -> containsAwait(handler.body()));
    }

    // === Bodies ===

    private void validateFunction(Statement.FunctionDeclaration function, Option<ClassShape> owner) {
        var kind = owner.isEmpty()
                   ? BodyKind.FUNCTION
                   : function.name().equals(ClassShape.CONSTRUCTOR) ? BodyKind.CONSTRUCTOR : BodyKind.METHOD;
        var context = new Context(moduleScope.child(true), owner, kind, function.span());
        declareParameters(context, function.parameters());
        validateBlock(function.body(), context);
    }

    private void validateProperty(Statement.PropertyDeclaration property, Option<ClassShape> owner) {
        var getter = new Context(moduleScope.child(true), owner, BodyKind.ACCESSOR, property.span());
        validateBlock(property.getter(), getter);
        property.setter()
                .forEach(setter -> {
                    var context = new Context(moduleScope.child(true), owner, BodyKind.ACCESSOR, property.span());
                    declareParameters(context, List.of(setter.parameter()));
                    validateBlock(setter.body(), context);
                });
    }

    private void validateClass(Statement.ClassDeclaration declaration) {
        var shape = classes.get(declaration.name());
        if (shape == null || shape.declaration() != declaration) {
            shape = ClassShape.of(declaration);
        }
        var owner = Option.some(shape);
        var fieldNames = new ArrayList<>(shape.fields().keySet());
        for (var member : declaration.members()) {
            if (member instanceof Statement.VarDeclaration field) {
                var index = fieldNames.indexOf(field.name());
                var later = index < 0 ? Set.<String>of() : Set.copyOf(fieldNames.subList(index, fieldNames.size()));
                var context = new Context(moduleScope.child(true), owner, BodyKind.FIELD_INITIALISER, field.span());
                context.uninitialisedFields = later;
                field.initializer().forEach(init -> validateExpression(init, context));
            } else if (member instanceof Statement.FunctionDeclaration method) {
                validateFunction(method, owner);
            } else if (member instanceof Statement.PropertyDeclaration property) {
                validateProperty(property, owner);
            }
        }
    }

    private void declareParameters(Context context, List<Statement.Parameter> parameters) {
        for (var parameter : parameters) {
            if (context.scope.declared(parameter.name()).isDefined()) {
                duplicate(parameter.name(), parameter.span());
                continue;
            }
            var symbol = new Symbol(Symbol.Kind.PARAMETER, parameter.name(), parameter.span());
            context.scope.declare(symbol);
            bindings.put(parameter, symbol);
        }
    }

    private void validateBlock(List<Statement> statements, Context context) {
        for (var statement : statements) {
            validateStatement(statement, context, false);
        }
    }

    private void validateStatement(Statement statement, Context context, boolean topLevel) {
        if (statement instanceof Statement.FunctionDeclaration function) {
            if (topLevel) {
                validateFunction(function, Option.none());
            } else {
                nested("function", function.name(), function.span());
            }
        } else if (statement instanceof Statement.ClassDeclaration declaration) {
            if (topLevel) {
                validateClass(declaration);
            } else {
                nested("class", declaration.name(), declaration.span());
            }
        } else if (statement instanceof Statement.PropertyDeclaration property) {
            if (topLevel) {
                validateProperty(property, Option.none());
            } else {
                nested("property", property.name(), property.span());
            }
        } else if (statement instanceof Statement.DelegateDeclaration delegate) {
            nested("delegate", delegate.field(), delegate.span());
        } else if (statement instanceof Statement.VarDeclaration declaration) {
            declaration.initializer().forEach(init -> validateExpression(init, context));
            declareVariable(declaration.name(), declaration.span(), context)
                .forEach(symbol -> bindings.put(declaration, symbol));
        } else if (statement instanceof Statement.Assignment assignment) {
            validateExpression(assignment.value(), context);
            validateTarget(assignment.target(), context);
        } else if (statement instanceof Statement.ExpressionStatement expression) {
            validateExpression(expression.expression(), context);
        } else if (statement instanceof Statement.Return ret) {
            if (context.kind == BodyKind.SCRIPT) {
                report(DiagnosticCode.RETURN_OUTSIDE_FUNCTION, "'return' outside a function", ret.span());
            }
            ret.value().forEach(value -> validateExpression(value, context));
        } else if (statement instanceof Statement.Break brk) {
            loopControl("break", brk.span(), context);
        } else if (statement instanceof Statement.Continue cont) {
            loopControl("continue", cont.span(), context);
        } else if (statement instanceof Statement.Pass) {
            return;
        } else if (statement instanceof Statement.If conditional) {
            validateExpression(conditional.condition(), context);
            validateBlock(conditional.thenBranch(), context);
            validateBlock(conditional.elseBranch(), context);
        } else if (statement instanceof Statement.While loop) {
            validateExpression(loop.condition(), context);
            context.loopDepth++;
            validateBlock(loop.body(), context);
            context.loopDepth--;
        } else if (statement instanceof Statement.For loop) {
            validateLoop(loop, context);
        } else if (statement instanceof Statement.Try attempt) {
            validateTry(attempt, context);
        } else if (statement instanceof Statement.Raise raise) {
            if (raise.exception().isEmpty() && context.handlerDepth == 0) {
                report(DiagnosticCode.RERAISE_OUTSIDE_HANDLER, "'raise' without an exception outside an 'except' clause",
                       raise.span());
            }
            raise.exception().forEach(exception -> validateExpression(exception, context));
        } else if (statement instanceof Statement.Await await) {
            if (context.kind == BodyKind.ACCESSOR || context.kind == BodyKind.CONSTRUCTOR) {
                report(DiagnosticCode.SUSPENSION_NOT_ALLOWED,
                       "'await' is not allowed in a " + (context.kind == BodyKind.ACCESSOR ? "property accessor" : "constructor"),
                       await.span());
            }
            validateExpression(await.operand(), context);
        } else if (statement instanceof Statement.Async spawn) {
            validateCall(spawn.call(), context, true);
        }
    }

    private void validateLoop(Statement.For loop, Context context) {
        validateExpression(loop.iterable(), context);
        bindVariable(loop.variable(), "loop variable", context).forEach(symbol -> bindings.put(loop, symbol));
        context.loopDepth++;
        validateBlock(loop.body(), context);
        context.loopDepth--;
    }

    private void validateTry(Statement.Try attempt, Context context) {
        validateBlock(attempt.body(), context);
        var handlers = attempt.handlers();
        for (int i = 0; i < handlers.size(); i++) {
            var handler = handlers.get(i);
            if (handler.type().isEmpty() && i < handlers.size() - 1) {
                report(DiagnosticCode.MISPLACED_CATCH_ALL, "an 'except' clause without a type must come last", handler.span());
            }
            handler.type().forEach(type -> validateExpression(type, context));
            handler.name().forEach(name -> bindVariable(name, "exception variable", context));
            context.handlerDepth++;
            validateBlock(handler.body(), context);
            context.handlerDepth--;
        }
        attempt.finallyBody().forEach(body -> validateBlock(body, context));
    }

    /**
     * Binds a name a statement assigns implicitly, such as a loop or exception variable. An existing variable
     * of the same scope is reused.
     */
    private Option<Symbol> bindVariable(Statement.Parameter variable, String role, Context context) {
        var existing = context.scope.declared(variable.name());
        Option<Symbol> symbol;
        if (existing.isDefined()) {
            if (existing.get().isFrameSlot() || existing.get().kind() == Symbol.Kind.GLOBAL) {
                symbol = existing;
            } else {
                report(DiagnosticCode.INVALID_ASSIGNMENT_TARGET,
                       "cannot use " + describe(existing.get()) + " as a " + role,
                       variable.span());
                symbol = Option.none();
            }
        } else {
            symbol = declareVariable(variable.name(), variable.span(), context);
        }
        symbol.forEach(s -> bindings.put(variable, s));
        return symbol;
    }

    private Option<Symbol> declareVariable(String name, SourceSpan span, Context context) {
        if (context.scope.declared(name).isDefined()) {
            duplicate(name, span);
            return Option.none();
        }
        var kind = context.scope.isFunction() ? Symbol.Kind.LOCAL : Symbol.Kind.GLOBAL;
        var symbol = new Symbol(kind, name, span);
        context.scope.declare(symbol);
        return Option.some(symbol);
    }

    private void validateTarget(Expression target, Context context) {
        if (target instanceof Expression.Name name) {
            resolve(name, context).forEach(symbol -> {
                if (symbol.kind() == Symbol.Kind.PROPERTY) {
                    var property = properties.get(symbol.name());
                    if (property != null && property.setter().isEmpty()) {
                        getterOnly(symbol.name(), name.span());
                    }
                } else if (!symbol.isAssignable()) {
                    report(DiagnosticCode.INVALID_ASSIGNMENT_TARGET, "cannot assign to " + describe(symbol), name.span());
                }
            });
        } else if (target instanceof Expression.Attribute attribute) {
            validateExpression(attribute.target(), context);
            checkAttributeAssignment(attribute, context);
        } else if (target instanceof Expression.Index index) {
            validateExpression(index.target(), context);
            validateExpression(index.index(), context);
        } else {
            report(DiagnosticCode.INVALID_ASSIGNMENT_TARGET, "expression cannot be assigned to", target.span());
        }
    }

    private void checkAttributeAssignment(Expression.Attribute attribute, Context context) {
        var member = attribute.name();
        if (isSelf(attribute.target(), context)) {
            var owner = context.owner.get();
            checkSelfMember(attribute, context);
            for (var shape : lineage(owner)) {
                if (shape.fields().containsKey(member) || shape.methods().containsKey(member)) {
                    return;
                }
                var property = shape.properties().get(member);
                if (property != null) {
                    if (property.setter().isEmpty()) {
                        getterOnly(member, attribute.span());
                    }
                    return;
                }
            }
            return;
        }
        var declaring = classes.values()
                               .stream()
                               .filter(shape -> shape.declares(member))
                               .toList();
        var allGetterOnly = !declaring.isEmpty()
                            && declaring.stream()
                                        .allMatch(shape -> shape.properties().containsKey(member)
                                                           && shape.properties().get(member).setter().isEmpty());
        if (allGetterOnly) {
            getterOnly(member, attribute.span());
        }
    }

    // === Expressions ===

    private void validateExpression(Expression expression, Context context) {
        if (expression instanceof Expression.Name name) {
            resolve(name, context);
        } else if (expression instanceof Expression.Attribute attribute) {
            validateExpression(attribute.target(), context);
            if (isSelf(attribute.target(), context)) {
                checkSelfMember(attribute, context);
                if (context.uninitialisedFields.contains(attribute.name())) {
                    report(DiagnosticCode.FORWARD_FIELD_REFERENCE,
                           "field '" + attribute.name() + "' is read before it is initialised",
                           attribute.span());
                }
            }
        } else if (expression instanceof Expression.Index index) {
            validateExpression(index.target(), context);
            validateExpression(index.index(), context);
        } else if (expression instanceof Expression.Call call) {
            validateCall(call, context, false);
        } else if (expression instanceof Expression.Unary unary) {
            validateExpression(unary.operand(), context);
        } else if (expression instanceof Expression.Binary binary) {
            validateExpression(binary.left(), context);
            validateExpression(binary.right(), context);
        } else if (expression instanceof Expression.ListDisplay list) {
            list.elements().forEach(element -> validateExpression(element, context));
        } else if (expression instanceof Expression.TupleDisplay tuple) {
            tuple.elements().forEach(element -> validateExpression(element, context));
        } else if (expression instanceof Expression.DictDisplay dict) {
            for (var entry : dict.entries()) {
                validateExpression(entry.key(), context);
                validateExpression(entry.value(), context);
            }
        }
    }

    private void validateCall(Expression.Call call, Context context, boolean spawned) {
        validateExpression(call.callee(), context);
        call.arguments().forEach(argument -> validateExpression(argument, context));

        var callee = call.callee();
        var arguments = call.arguments().size();
        if (callee instanceof Expression.Name name) {
            var symbol = Option.of(bindings.get(name));
            if (symbol.isEmpty()) {
                return;
            }
            if (symbol.get().kind() == Symbol.Kind.FUNCTION) {
                var function = functions.get(name.name());
                checkArity(name.name(), function.parameters().size(), arguments, call.span());
                if (!spawned && suspendingFunctions.contains(name.name())) {
                    synchronousSuspendingCall("function '" + name.name() + "'", call.span());
                }
            } else if (symbol.get().kind() == Symbol.Kind.CLASS) {
                var shape = classes.get(name.name());
                var constructor = constructorOf(shape);
                if (constructor.isDefined()) {
                    checkArity(name.name(), constructor.get().parameters().size(), arguments, call.span());
                } else if (!brokenHierarchies.contains(shape.name())) {
                    checkArity(name.name(), 0, arguments, call.span());
                }
            }
        } else if (callee instanceof Expression.Attribute attribute && !spawned) {
            var method = attribute.name();
            if (isSelf(attribute.target(), context)) {
                for (var shape : lineage(context.owner.get())) {
                    if (shape.declares(method)) {
                        if (suspendingMethods.contains(shape.name() + "." + method)) {
                            synchronousSuspendingCall("method '" + method + "'", call.span());
                        }
                        return;
                    }
                }
                return;
            }
            var declaring = classes.values()
                                   .stream()
                                   .filter(shape -> shape.declares(method))
                                   .toList();
            if (!declaring.isEmpty() && declaring.stream()
                                                 .allMatch(shape -> suspendingMethods.contains(shape.name() + "." + method))) {
                synchronousSuspendingCall("method '" + method + "'", call.span());
            }
        }
    }

    private Option<Statement.FunctionDeclaration> constructorOf(ClassShape shape) {
        for (var ancestor : lineage(shape)) {
            var init = ancestor.constructor();
            if (init.isDefined()) {
                return init;
            }
        }
        return Option.none();
    }

    private void checkArity(String callee, int expected, int actual, SourceSpan span) {
        if (expected != actual) {
            report(DiagnosticCode.ARITY_MISMATCH,
                   "'" + callee + "' takes " + expected + " argument(s) but " + actual + " were given",
                   span);
        }
    }

    private Option<Symbol> resolve(Expression.Name name, Context context) {
        if (name.name().equals(SELF) && context.owner.isDefined()) {
            var symbol = new Symbol(Symbol.Kind.SELF, SELF, context.declaration);
            bindings.put(name, symbol);
            return Option.some(symbol);
        }
        var symbol = context.scope.lookup(name.name());
        if (symbol.isEmpty()) {
            if (name.name().equals(SELF)) {
                report(DiagnosticCode.SELF_OUTSIDE_METHOD, "'self' used outside a class member", name.span());
            } else {
                report(DiagnosticCode.UNDECLARED_NAME, "undeclared name '" + name.name() + "'", name.span());
            }
            return Option.none();
        }
        bindings.put(name, symbol.get());
        return symbol;
    }

    private static boolean isSelf(Expression expression, Context context) {
        return context.owner.isDefined() && expression instanceof Expression.Name name && name.name().equals(SELF);
    }

    private void checkSelfMember(Expression.Attribute attribute, Context context) {
        var owner = context.owner.get();
        if (brokenHierarchies.contains(owner.name())) {
            return;
        }
        var lineage = lineage(owner);
        var member = attribute.name();
        for (var shape : lineage) {
            if (shape.declares(member) || !shape.delegates().isEmpty()) {
                return;
            }
        }
        report(DiagnosticCode.UNKNOWN_MEMBER, "class '" + owner.name() + "' has no member '" + member + "'", attribute.span());
    }

    private List<ClassShape> lineage(ClassShape shape) {
        var result = new ArrayList<ClassShape>();
        var seen = new HashSet<String>();
        var current = Option.of(shape);
        while (current.isDefined() && seen.add(current.get().name())) {
            result.add(current.get());
            current = current.get()
                             .superclass()
                             .flatMap(name -> Option.of(classes.get(name)));
        }
        return result;
    }

    // === Reporting ===

    private void report(DiagnosticCode code, String message, SourceSpan span) {
        diagnostics.add(Diagnostic.error(Stage.VALIDATION, code.code(), message, span));
    }

    private void duplicate(String name, SourceSpan span) {
        report(DiagnosticCode.DUPLICATE_DECLARATION, "'" + name + "' is already declared in this scope", span);
    }

    private void nested(String what, String name, SourceSpan span) {
        report(DiagnosticCode.NESTED_DECLARATION,
               what + " '" + name + "' must be declared at module level",
               span);
    }

    private void loopControl(String keyword, SourceSpan span, Context context) {
        if (context.loopDepth == 0) {
            report(DiagnosticCode.LOOP_CONTROL_OUTSIDE_LOOP, "'" + keyword + "' outside a loop", span);
        }
    }

    private void getterOnly(String property, SourceSpan span) {
        diagnostics.add(Diagnostic.error(Stage.VALIDATION,
                                         DiagnosticCode.GETTER_ONLY_ASSIGNMENT.code(),
                                         "property '" + property + "' has no setter",
                                         span)
                                  .withHelp("declare a 'set' clause or assign the backing field"));
    }

    private void synchronousSuspendingCall(String callee, SourceSpan span) {
        diagnostics.add(Diagnostic.error(Stage.VALIDATION,
                                         DiagnosticCode.SYNCHRONOUS_CALL_OF_SUSPENDING.code(),
                                         callee + " suspends and can only be started with 'async'",
                                         span));
    }

    private static String describe(Symbol symbol) {
        return switch (symbol.kind()) {
            case FUNCTION -> "function '" + symbol.name() + "'";
            case CLASS -> "class '" + symbol.name() + "'";
            case BUILTIN -> "builtin '" + symbol.name() + "'";
            case SELF -> "'self'";
            default -> "'" + symbol.name() + "'";
        };
    }

    private enum BodyKind {
        SCRIPT,
        FUNCTION,
        METHOD,
        CONSTRUCTOR,
        ACCESSOR,
        FIELD_INITIALISER
    }

    private static final class Context {
        private final Scope scope;
        private final Option<ClassShape> owner;
        private final BodyKind kind;
        private final SourceSpan declaration;
        private int loopDepth;
        private int handlerDepth;
        private Set<String> uninitialisedFields = Set.of();

        private Context(Scope scope, Option<ClassShape> owner, BodyKind kind, SourceSpan declaration) {
            this.scope = scope;
            this.owner = owner;
            this.kind = kind;
            this.declaration = declaration;
        }
    }
}
