package org.pragmatica.spek.program;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.apache.log4j.Logger;
import org.pragmatica.spek.error.CompileError;
import org.pragmatica.spek.error.CompileError.TranslationError;
import org.pragmatica.spek.syntax.BinaryOperator;
import org.pragmatica.spek.syntax.Expression;
import org.pragmatica.spek.syntax.Statement;
import org.pragmatica.spek.tree.SourceSpan;
import org.pragmatica.spek.validation.ClassShape;
import org.pragmatica.spek.validation.Symbol;
import org.pragmatica.spek.validation.ValidatedModule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers a validated module into a {@link MachineProgram}. Structured control flow becomes a graph of
 * fragments linked by jumps and branches, and every {@code await} closes the current fragment.
 *
 * <p>A {@code try} body runs in fragments whose handler leads to the clause dispatch; {@code finally} code is
 * copied onto every path that leaves the statement: normal completion, propagation, {@code break},
 * {@code continue} and {@code return}.
 */
public final class Translator {
    private static final Logger logger = Logger.getLogger(Translator.class);

    public static final String SCRIPT = "<script>";
    public static final String LEN = "len";
    public static final String ISINSTANCE = "isinstance";

    private final ValidatedModule validated;
    private final Map<Symbol, Integer> globalSlots = new HashMap<>();
    private final List<String> globalNames = new ArrayList<>();
    private final Map<String, CodeUnit> units = new LinkedHashMap<>();
    private final Map<String, ClassLayout> layouts = new LinkedHashMap<>();

    private Translator(ValidatedModule validated) {
        this.validated = validated;
    }

    public static Either<CompileError, MachineProgram> translate(ValidatedModule validated) {
        try {
            return Either.right(new Translator(validated).run());
        } catch (TranslationFault fault) {
            logger.debug("Translation failed: " + fault.error.message());
            return Either.left(fault.error);
        }
    }

    private MachineProgram run() {
        var properties = new LinkedHashMap<String, PropertyLayout>();
        var script = new UnitBuilder(SCRIPT, UnitKind.SCRIPT, false);
        for (var statement : validated.module().statements()) {
            if (statement instanceof Statement.FunctionDeclaration
                || statement instanceof Statement.ClassDeclaration
                || statement instanceof Statement.PropertyDeclaration) {
                continue;
            }
            script.statement(statement);
        }
        add(script.finish());

        for (var statement : validated.module().statements()) {
            if (statement instanceof Statement.FunctionDeclaration function) {
                translateFunction(function.name(), UnitKind.FUNCTION, false, function.parameters(), function.body());
            } else if (statement instanceof Statement.PropertyDeclaration property) {
                properties.put(property.name(), translateProperty(property.name(), property, false));
            }
        }
        for (var shape : validated.classes().values()) {
            translateClass(shape);
        }
        for (var name : validated.classes().keySet()) {
            layout(name);
        }

        logger.debug("Translated " + units.size() + " code unit(s), " + layouts.size() + " class layout(s), "
                     + globalNames.size() + " global(s)");
        return new MachineProgram(SCRIPT, units, layouts, globalNames, properties);
    }

    private void add(CodeUnit unit) {
        units.put(unit.name(), unit);
    }

    private void translateFunction(String name,
                                   UnitKind kind,
                                   boolean receiver,
                                   List<Statement.Parameter> parameters,
                                   List<Statement> body) {
        var builder = new UnitBuilder(name, kind, receiver);
        for (var parameter : parameters) {
            builder.parameter(symbolOf(parameter, parameter.span()));
        }
        for (var statement : body) {
            builder.statement(statement);
        }
        add(builder.finish());
    }

    private PropertyLayout translateProperty(String qualified, Statement.PropertyDeclaration property, boolean receiver) {
        var getter = qualified + ".get";
        translateFunction(getter, UnitKind.GETTER, receiver, List.of(), property.getter());
        Option<String> setter = Option.none();
        if (property.setter().isDefined()) {
            var clause = property.setter().get();
            var name = qualified + ".set";
            translateFunction(name, UnitKind.SETTER, receiver, List.of(clause.parameter()), clause.body());
            setter = Option.some(name);
        }
        return new PropertyLayout(property.name(), getter, setter);
    }

    // === Classes ===

    private void translateClass(ClassShape shape) {
        var name = shape.name();
        if (!shape.fields().isEmpty()) {
            var builder = new UnitBuilder(fieldsUnit(name), UnitKind.FIELDS, true);
            for (var field : shape.fields().values()) {
                var value = field.initializer()
                                 .map(builder::term)
                                 .getOrElse(new Term.NoneConstant());
                builder.emit(new Instruction.StoreAttribute(field.span(), builder.self(), field.name(), value));
            }
            add(builder.finish());
        }
        shape.methods()
             .forEach((method, declaration) -> translateFunction(name + "." + method,
                                                                  UnitKind.METHOD,
                                                                  true,
                                                                  declaration.parameters(),
                                                                  declaration.body()));
        shape.properties()
             .forEach((property, declaration) -> translateProperty(name + "." + property, declaration, true));
    }

    private static String fieldsUnit(String className) {
        return className + ".<fields>";
    }

    private ClassLayout layout(String name) {
        var existing = layouts.get(name);
        if (existing != null) {
            return existing;
        }
        var shape = validated.classes().get(name);
        if (shape == null) {
            throw new TranslationFault(new TranslationError(SourceSpan.NONE, "class " + name, "unknown class"));
        }
        var parent = shape.superclass().map(this::layout);

        var fields = new ArrayList<String>(parent.map(ClassLayout::fields).getOrElse(List.of()));
        var methods = new LinkedHashMap<String, String>(parent.map(ClassLayout::methods).getOrElse(Map.of()));
        var properties = new LinkedHashMap<String, PropertyLayout>(parent.map(ClassLayout::properties).getOrElse(Map.of()));
        var delegates = new ArrayList<String>(parent.map(ClassLayout::delegates).getOrElse(List.of()));
        var initialisers = new ArrayList<String>(parent.map(ClassLayout::fieldInitialisers).getOrElse(List.of()));

        for (var field : shape.fields().keySet()) {
            if (!fields.contains(field)) {
                fields.add(field);
            }
        }
        if (!shape.fields().isEmpty()) {
            initialisers.add(fieldsUnit(name));
        }
        shape.methods().keySet().forEach(method -> methods.put(method, name + "." + method));
        shape.properties()
             .forEach((property, declaration) -> properties.put(property,
                                                                new PropertyLayout(property,
                                                                                   name + "." + property + ".get",
                                                                                   declaration.setter()
                                                                                              .map(s -> name + "." + property + ".set"))));
        for (var delegate : shape.delegates()) {
            if (!delegates.contains(delegate)) {
                delegates.add(delegate);
            }
        }
        var constructor = shape.constructor().isDefined()
                          ? Option.some(name + "." + ClassShape.CONSTRUCTOR)
                          : parent.flatMap(ClassLayout::constructor);

        var layout = new ClassLayout(name, shape.superclass(), fields, methods, properties, delegates, initialisers, constructor);
        layouts.put(name, layout);
        return layout;
    }

    // === Symbols ===

    private Symbol symbolOf(Statement.Parameter parameter, SourceSpan span) {
        return validated.symbol(parameter)
                        .getOrElseThrow(() -> unresolved("parameter '" + parameter.name() + "'", span));
    }

    private int globalSlot(Symbol symbol) {
        return globalSlots.computeIfAbsent(symbol, s -> {
            globalNames.add(s.name());
            return globalNames.size() - 1;
        });
    }

    private static TranslationFault unresolved(String node, SourceSpan span) {
        return new TranslationFault(new TranslationError(span, node, "name was not resolved by validation"));
    }

    // === Unit construction ===

    private static final class Block {
        private final List<Instruction> instructions = new ArrayList<>();
        private final Option<Fragment.Handler> handler;
        private Terminator terminator;

        private Block(Option<Fragment.Handler> handler) {
            this.handler = handler;
        }
    }

    private record LoopTargets(int continueTarget, int breakTarget) {}

    /**
     * {@code finally} body still to run when control leaves its {@code try}.
     *
     * @param loopDepth Loops enclosing the {@code try}
     * @param region    Handler in force around the {@code try}
     * @param enclosing Pending {@code finally} bodies around the {@code try}, innermost first
     */
    private record PendingFinally(List<Statement> body,
                                  int loopDepth,
                                  Option<Fragment.Handler> region,
                                  List<PendingFinally> enclosing) {}

    private final class UnitBuilder {
        private final String name;
        private final UnitKind kind;
        private final boolean receiver;
        private final List<String> slotNames = new ArrayList<>();
        private final Map<Symbol, Integer> slots = new HashMap<>();
        private final List<Block> blocks = new ArrayList<>();
        private final Deque<LoopTargets> loops = new ArrayDeque<>();
        private final Deque<PendingFinally> finallies = new ArrayDeque<>();
        private final Deque<Integer> handling = new ArrayDeque<>();
        private Option<Fragment.Handler> handler = Option.none();
        private int arity;
        private int current;

        private UnitBuilder(String name, UnitKind kind, boolean receiver) {
            this.name = name;
            this.kind = kind;
            this.receiver = receiver;
            if (receiver) {
                slotNames.add("self");
            }
            this.current = newBlock();
        }

        void parameter(Symbol symbol) {
            slot(symbol);
            arity++;
        }

        Term self() {
            return new Term.Local(0, "self");
        }

        private int slot(Symbol symbol) {
            return slots.computeIfAbsent(symbol, s -> hidden(s.name()));
        }

        private int hidden(String slotName) {
            slotNames.add(slotName);
            return slotNames.size() - 1;
        }

        private int newBlock() {
            blocks.add(new Block(handler));
            return blocks.size() - 1;
        }

        private int newBlock(Option<Fragment.Handler> region) {
            blocks.add(new Block(region));
            return blocks.size() - 1;
        }

        /**
         * Continues in a fresh block covered by {@code region}.
         */
        private void enterRegion(Option<Fragment.Handler> region) {
            handler = region;
            var block = newBlock();
            jumpIfOpen(SourceSpan.NONE, block);
            switchTo(block);
        }

        private void switchTo(int block) {
            current = block;
        }

        private Block open() {
            if (blocks.get(current).terminator != null) {
                current = newBlock();
            }
            return blocks.get(current);
        }

        void emit(Instruction instruction) {
            open().instructions.add(instruction);
        }

        private void terminate(Terminator terminator) {
            open().terminator = terminator;
        }

        private void jumpIfOpen(SourceSpan span, int target) {
            if (blocks.get(current).terminator == null) {
                blocks.get(current).terminator = new Terminator.Jump(span, target);
            }
        }

        // === Statements ===

        void statement(Statement statement) {
            if (statement instanceof Statement.VarDeclaration declaration) {
                var symbol = validated.symbol(declaration)
                                      .getOrElseThrow(() -> unresolved("variable '" + declaration.name() + "'", declaration.span()));
                var value = declaration.initializer()
                                       .map(this::term)
                                       .getOrElse(new Term.NoneConstant());
                store(symbol, value, declaration.span());
            } else if (statement instanceof Statement.Assignment assignment) {
                assign(assignment);
            } else if (statement instanceof Statement.ExpressionStatement expression) {
                emit(new Instruction.Evaluate(expression.span(), term(expression.expression())));
            } else if (statement instanceof Statement.Return ret) {
                returnStatement(ret);
            } else if (statement instanceof Statement.Break brk) {
                var target = loop(brk.span(), "break").breakTarget();
                leave(loops.size());
                terminate(new Terminator.Jump(brk.span(), target));
            } else if (statement instanceof Statement.Continue cont) {
                var target = loop(cont.span(), "continue").continueTarget();
                leave(loops.size());
                terminate(new Terminator.Jump(cont.span(), target));
            } else if (statement instanceof Statement.Raise raise) {
                var exception = raise.exception()
                                     .map(this::term)
                                     .getOrElse(() -> handledException(raise.span()));
                terminate(new Terminator.Raise(raise.span(), exception));
            } else if (statement instanceof Statement.Try attempt) {
                tryStatement(attempt);
            } else if (statement instanceof Statement.Pass) {
                return;
            } else if (statement instanceof Statement.If conditional) {
                conditional(conditional);
            } else if (statement instanceof Statement.While loop) {
                whileLoop(loop);
            } else if (statement instanceof Statement.For loop) {
                forLoop(loop);
            } else if (statement instanceof Statement.Await await) {
                var operand = term(await.operand());
                var resume = newBlock();
                terminate(new Terminator.Suspend(await.span(), await.kind(), operand, resume));
                switchTo(resume);
            } else if (statement instanceof Statement.Async spawn) {
                var call = spawn.call();
                emit(new Instruction.Spawn(spawn.span(), term(call.callee()), terms(call.arguments())));
            } else {
                throw new TranslationFault(new TranslationError(statement.span(),
                                                                statement.getClass().getSimpleName(),
                                                                "declaration is only allowed at module level"));
            }
        }

        private LoopTargets loop(SourceSpan span, String keyword) {
            if (loops.isEmpty()) {
                throw new TranslationFault(new TranslationError(span, keyword, "no enclosing loop"));
            }
            return loops.peek();
        }

        private void store(Symbol symbol, Term value, SourceSpan span) {
            switch (symbol.kind()) {
                case LOCAL, PARAMETER -> emit(new Instruction.StoreLocal(span, slot(symbol), value));
                case GLOBAL -> emit(new Instruction.StoreGlobal(span, globalSlot(symbol), value));
                case PROPERTY -> emit(new Instruction.StoreProperty(span, symbol.name(), value));
                default -> throw new TranslationFault(new TranslationError(span, "assignment", "cannot assign to " + symbol.name()));
            }
        }

        /**
         * A value being returned is saved before pending {@code finally} bodies run, so they cannot change it.
         */
        private void returnStatement(Statement.Return ret) {
            if (finallies.isEmpty()) {
                terminate(new Terminator.Return(ret.span(), ret.value().map(this::term)));
                return;
            }
            Option<Term> value = Option.none();
            if (ret.value().isDefined()) {
                var result = hidden("$result" + slotNames.size());
                emit(new Instruction.StoreLocal(ret.span(), result, term(ret.value().get())));
                value = Option.some(new Term.Local(result, slotNames.get(result)));
            }
            leave(0);
            terminate(new Terminator.Return(ret.span(), value));
        }

        /**
         * Runs the pending {@code finally} bodies of every {@code try} entered inside {@code loopDepth} loops,
         * innermost first.
         */
        private void leave(int loopDepth) {
            var pending = new ArrayList<PendingFinally>();
            for (var entry : finallies) {
                if (entry.loopDepth() < loopDepth) {
                    break;
                }
                pending.add(entry);
            }
            pending.forEach(this::inline);
        }

        private void inline(PendingFinally entry) {
            var savedRegion = handler;
            var savedFinallies = new ArrayList<>(finallies);
            var savedLoops = new ArrayList<>(loops);
            finallies.clear();
            finallies.addAll(entry.enclosing());
            while (loops.size() > entry.loopDepth()) {
                loops.pop();
            }
            enterRegion(entry.region());
            entry.body().forEach(this::statement);
            finallies.clear();
            finallies.addAll(savedFinallies);
            loops.clear();
            loops.addAll(savedLoops);
            enterRegion(savedRegion);
        }

        private Term handledException(SourceSpan span) {
            if (handling.isEmpty()) {
                throw new TranslationFault(new TranslationError(span, "raise", "no exception is being handled"));
            }
            var slot = handling.peek();
            return new Term.Local(slot, slotNames.get(slot));
        }

        private void tryStatement(Statement.Try attempt) {
            var span = attempt.span();
            var outer = handler;
            var exit = newBlock();
            var normal = newBlock();
            var finallyEntry = attempt.finallyBody()
                                      .map(body -> new PendingFinally(body, loops.size(), outer, List.copyOf(finallies)));
            Option<Fragment.Handler> cleanup = Option.none();
            if (finallyEntry.isDefined()) {
                var pending = hidden("$pending" + slotNames.size());
                cleanup = Option.some(new Fragment.Handler(newBlock(), pending));
            }
            var dispatchRegion = cleanup.orElse(outer);
            var bodyRegion = cleanup;
            var exception = -1;
            var dispatch = -1;
            if (!attempt.handlers().isEmpty()) {
                exception = hidden("$exception" + slotNames.size());
                dispatch = newBlock(dispatchRegion);
                bodyRegion = Option.some(new Fragment.Handler(dispatch, exception));
            }

            finallyEntry.forEach(finallies::push);
            enterRegion(bodyRegion);
            attempt.body().forEach(this::statement);
            jumpIfOpen(span, normal);

            if (dispatch >= 0) {
                handler = dispatchRegion;
                switchTo(dispatch);
                exceptClauses(attempt, new Term.Local(exception, slotNames.get(exception)), exception, normal);
            }
            finallyEntry.forEach(entry -> finallies.pop());

            if (cleanup.isDefined()) {
                var pending = cleanup.get();
                handler = outer;
                switchTo(pending.target());
                inline(finallyEntry.get());
                terminate(new Terminator.Raise(span, new Term.Local(pending.slot(), slotNames.get(pending.slot()))));
            }
            handler = outer;
            switchTo(normal);
            finallyEntry.forEach(this::inline);
            jumpIfOpen(span, exit);
            switchTo(exit);
        }

        /**
         * Tries the clauses in order; an exception no clause accepts is raised again.
         */
        private void exceptClauses(Statement.Try attempt, Term exception, int slot, int normal) {
            for (var clause : attempt.handlers()) {
                var body = newBlock();
                var next = newBlock();
                var condition = clause.type()
                                      .map(type -> (Term) new Term.Call(new Term.BuiltinRef(ISINSTANCE),
                                                                        List.of(exception, term(type))))
                                      .getOrElse(new Term.BoolConstant(true));
                terminate(new Terminator.Branch(clause.span(), condition, body, next));

                switchTo(body);
                clause.name().forEach(name -> store(symbolOf(name, name.span()), exception, name.span()));
                handling.push(slot);
                clause.body().forEach(this::statement);
                handling.pop();
                jumpIfOpen(clause.span(), normal);

                switchTo(next);
            }
            terminate(new Terminator.Raise(attempt.span(), exception));
        }

        private void assign(Statement.Assignment assignment) {
            var target = assignment.target();
            var value = term(assignment.value());
            var span = assignment.span();
            if (target instanceof Expression.Name name) {
                var symbol = validated.symbol(name)
                                      .getOrElseThrow(() -> unresolved("name '" + name.name() + "'", name.span()));
                store(symbol, value, span);
            } else if (target instanceof Expression.Attribute attribute) {
                emit(new Instruction.StoreAttribute(span, term(attribute.target()), attribute.name(), value));
            } else if (target instanceof Expression.Index index) {
                emit(new Instruction.StoreIndex(span, term(index.target()), term(index.index()), value));
            } else {
                throw new TranslationFault(new TranslationError(span, "assignment", "target is not assignable"));
            }
        }

        private void conditional(Statement.If conditional) {
            var condition = term(conditional.condition());
            var thenBlock = newBlock();
            var elseBlock = conditional.elseBranch().isEmpty() ? -1 : newBlock();
            var join = newBlock();
            terminate(new Terminator.Branch(conditional.span(), condition, thenBlock, elseBlock < 0 ? join : elseBlock));

            switchTo(thenBlock);
            conditional.thenBranch().forEach(this::statement);
            jumpIfOpen(conditional.span(), join);

            if (elseBlock >= 0) {
                switchTo(elseBlock);
                conditional.elseBranch().forEach(this::statement);
                jumpIfOpen(conditional.span(), join);
            }
            switchTo(join);
        }

        private void whileLoop(Statement.While loop) {
            var header = newBlock();
            terminate(new Terminator.Jump(loop.span(), header));
            var body = newBlock();
            var exit = newBlock();

            switchTo(header);
            terminate(new Terminator.Branch(loop.span(), term(loop.condition()), body, exit));

            switchTo(body);
            loops.push(new LoopTargets(header, exit));
            loop.body().forEach(this::statement);
            loops.pop();
            jumpIfOpen(loop.span(), header);

            switchTo(exit);
        }

        /**
         * {@code for x in s} walks a snapshot reference to the sequence with a hidden index; the index is
         * advanced before the body so that {@code continue} can jump straight to the test.
         */
        private void forLoop(Statement.For loop) {
            var span = loop.span();
            var variable = validated.symbol(loop)
                                    .getOrElseThrow(() -> unresolved("loop variable '" + loop.variable().name() + "'", span));
            var sequence = hidden("$seq" + slotNames.size());
            var index = hidden("$index" + slotNames.size());
            var sequenceRef = new Term.Local(sequence, slotNames.get(sequence));
            var indexRef = new Term.Local(index, slotNames.get(index));

            emit(new Instruction.StoreLocal(span, sequence, new Term.Sequence(term(loop.iterable()))));
            emit(new Instruction.StoreLocal(span, index, new Term.IntConstant(0)));
            var header = newBlock();
            terminate(new Terminator.Jump(span, header));
            var body = newBlock();
            var exit = newBlock();

            switchTo(header);
            var length = new Term.Call(new Term.BuiltinRef(LEN), List.of(sequenceRef));
            terminate(new Terminator.Branch(span, new Term.Binary(BinaryOperator.LT, indexRef, length), body, exit));

            switchTo(body);
            store(variable, new Term.Index(sequenceRef, indexRef), loop.variable().span());
            emit(new Instruction.StoreLocal(span, index, new Term.Binary(BinaryOperator.ADD, indexRef, new Term.IntConstant(1))));
            loops.push(new LoopTargets(header, exit));
            loop.body().forEach(this::statement);
            loops.pop();
            jumpIfOpen(span, header);

            switchTo(exit);
        }

        // === Expressions ===

        Term term(Expression expression) {
            if (expression instanceof Expression.NoneLiteral) {
                return new Term.NoneConstant();
            }
            if (expression instanceof Expression.BooleanLiteral literal) {
                return new Term.BoolConstant(literal.value());
            }
            if (expression instanceof Expression.IntegerLiteral literal) {
                return new Term.IntConstant(literal.value());
            }
            if (expression instanceof Expression.FloatLiteral literal) {
                return new Term.RealConstant(literal.value());
            }
            if (expression instanceof Expression.StringLiteral literal) {
                return new Term.StrConstant(literal.value());
            }
            if (expression instanceof Expression.Name name) {
                return reference(name);
            }
            if (expression instanceof Expression.Attribute attribute) {
                return new Term.Attribute(term(attribute.target()), attribute.name());
            }
            if (expression instanceof Expression.Index index) {
                return new Term.Index(term(index.target()), term(index.index()));
            }
            if (expression instanceof Expression.Call call) {
                return new Term.Call(term(call.callee()), terms(call.arguments()));
            }
            if (expression instanceof Expression.Unary unary) {
                return new Term.Unary(unary.operator(), term(unary.operand()));
            }
            if (expression instanceof Expression.Binary binary) {
                return new Term.Binary(binary.operator(), term(binary.left()), term(binary.right()));
            }
            if (expression instanceof Expression.ListDisplay list) {
                return new Term.MakeList(terms(list.elements()));
            }
            if (expression instanceof Expression.TupleDisplay tuple) {
                return new Term.MakeTuple(terms(tuple.elements()));
            }
            if (expression instanceof Expression.DictDisplay dict) {
                var keys = new ArrayList<Term>();
                var values = new ArrayList<Term>();
                for (var entry : dict.entries()) {
                    keys.add(term(entry.key()));
                    values.add(term(entry.value()));
                }
                return new Term.MakeDict(keys, values);
            }
            throw new TranslationFault(new TranslationError(expression.span(),
                                                            expression.getClass().getSimpleName(),
                                                            "no lowering for expression"));
        }

        private List<Term> terms(List<Expression> expressions) {
            var result = new ArrayList<Term>(expressions.size());
            for (var expression : expressions) {
                result.add(term(expression));
            }
            return result;
        }

        private Term reference(Expression.Name name) {
            var symbol = validated.symbol(name)
                                  .getOrElseThrow(() -> unresolved("name '" + name.name() + "'", name.span()));
            return switch (symbol.kind()) {
                case LOCAL, PARAMETER -> new Term.Local(slot(symbol), symbol.name());
                case SELF -> {
                    if (!receiver) {
                        throw new TranslationFault(new TranslationError(name.span(), "self", "unit has no receiver"));
                    }
                    yield self();
                }
                case GLOBAL -> new Term.Global(globalSlot(symbol), symbol.name());
                case FUNCTION -> new Term.FunctionRef(symbol.name());
                case CLASS -> new Term.ClassRef(symbol.name());
                case PROPERTY -> new Term.PropertyRead(symbol.name());
                case BUILTIN -> new Term.BuiltinRef(symbol.name());
            };
        }

        // === Finishing ===

        /**
         * Closes open blocks with an implicit {@code return None}, drops fragments unreachable from the entry
         * and renumbers the rest in their original order.
         */
        CodeUnit finish() {
            for (var block : blocks) {
                if (block.terminator == null) {
                    block.terminator = new Terminator.Return(SourceSpan.NONE, Option.none());
                }
            }
            var reachable = new boolean[blocks.size()];
            var work = new ArrayDeque<Integer>();
            work.push(0);
            while (!work.isEmpty()) {
                var index = work.pop();
                if (reachable[index]) {
                    continue;
                }
                reachable[index] = true;
                var block = blocks.get(index);
                block.terminator.successors().forEach(work::push);
                block.handler.forEach(h -> work.push(h.target()));
            }
            var renumbered = new int[blocks.size()];
            Arrays.fill(renumbered, -1);
            var next = 0;
            for (int i = 0; i < blocks.size(); i++) {
                if (reachable[i]) {
                    renumbered[i] = next++;
                }
            }
            var fragments = new ArrayList<Fragment>(next);
            for (int i = 0; i < blocks.size(); i++) {
                if (reachable[i]) {
                    var block = blocks.get(i);
                    var handler = block.handler.map(h -> new Fragment.Handler(renumbered[h.target()], h.slot()));
                    fragments.add(new Fragment(renumbered[i],
                                               block.instructions,
                                               block.terminator.remap(t -> renumbered[t]),
                                               handler));
                }
            }
            return new CodeUnit(name, kind, arity, receiver, slotNames, fragments);
        }
    }

    private static final class TranslationFault extends RuntimeException {
        private final TranslationError error;

        private TranslationFault(TranslationError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
