package com.logicsynth.facts;

import com.logicsynth.contract.Diagnostic;
import com.logicsynth.contract.ProgramBinder;
import com.logicsynth.contract.ProgramSpecValidator;
import com.logicsynth.contract.SynthesisDocument.ExprSpec;
import com.logicsynth.ir.Lexicon;
import com.logicsynth.ir.Term;
import com.logicsynth.schema.SchemaRegistry;
import com.logicsynth.schema.ValueType;
import com.logicsynth.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Type canary in front of the fact store. Tagged values are the normal path; the loose path
 * applies {@link LoosePromotion} first and then goes through the same checks.
 */
@Service
public class FactIngestionService {

    private static final Logger log = LoggerFactory.getLogger(FactIngestionService.class);

    private final FactStore store;
    private final Session session;
    private final ProgramSpecValidator validator;
    private final ProgramBinder binder;
    private final boolean requireDeclarations;

    public FactIngestionService(FactStore store,
                                Session session,
                                ProgramSpecValidator validator,
                                ProgramBinder binder,
                                @Value("${logicsynth.facts.require-declarations:false}") boolean requireDeclarations) {
        this.store = store;
        this.session = session;
        this.validator = validator;
        this.binder = binder;
        this.requireDeclarations = requireDeclarations;
    }

    public IngestedFact addTagged(String predicate, List<ExprSpec> args) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<ExprSpec> values = args == null ? List.of() : args;
        for (int i = 0; i < values.size(); i++) {
            validator.validateExpr(values.get(i), "args[" + i + "]", diagnostics);
        }
        if (!diagnostics.isEmpty()) {
            throw mismatch(predicate, diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("; ")));
        }
        List<Term> terms = values.stream().map(binder::bindExpr).toList();
        return add(new Fact(predicate, terms));
    }

    public IngestedFact addLoose(String predicate, List<Object> args) {
        SchemaRegistry schema = session.schema();
        List<Object> values = args == null ? List.of() : args;
        List<Term> terms = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            ValueType expected = schema.expectedType(predicate, i).orElse(null);
            try {
                terms.add(LoosePromotion.promote(values.get(i), expected));
            } catch (IllegalArgumentException | ArithmeticException ex) {
                throw mismatch(predicate, "args[" + i + "]: " + ex.getMessage());
            }
        }
        log.debug("Loose arguments for {} promoted to {}", predicate, terms);
        return add(new Fact(predicate, terms));
    }

    /**
     * Checks {@code fact} against the session schema and stores it.
     *
     * @throws FactTypeMismatchException when the fact does not fit its predicate
     */
    public IngestedFact add(Fact fact) {
        check(fact, session.schema());
        boolean added = store.add(fact);
        return new IngestedFact(fact, added);
    }

    /**
     * @throws FactTypeMismatchException when {@code fact} does not fit {@code schema}
     */
    public void check(Fact fact, SchemaRegistry schema) {
        String predicate = fact.predicate();
        if (!Lexicon.isPredicate(predicate) || predicate.startsWith(":")) {
            throw mismatch(String.valueOf(predicate), "not a valid predicate symbol");
        }
        for (int i = 0; i < fact.arity(); i++) {
            Term arg = fact.args().get(i);
            if (!arg.isGround()) {
                throw mismatch(predicate, "args[" + i + "] is not ground; facts cannot contain variables");
            }
            if (arg instanceof Term.Apply) {
                throw mismatch(predicate, "args[" + i + "] is a function application, not a value");
            }
            if (arg instanceof Term.Name name && !Lexicon.isName(name.symbol())) {
                throw mismatch(predicate, "args[" + i + "] " + name.symbol() + " is not a valid name constant");
            }
        }

        if (!schema.isDeclared(predicate)) {
            if (requireDeclarations) {
                throw mismatch(predicate, "predicate is not declared");
            }
            return;
        }
        int arity = schema.arity(predicate).orElseThrow();
        if (arity != fact.arity()) {
            throw mismatch(predicate, "expected " + arity + " args, got " + fact.arity());
        }
        for (int i = 0; i < fact.arity(); i++) {
            Set<ValueType> allowed = schema.allowedTypes(predicate, i);
            Term arg = fact.args().get(i);
            if (!allowed.isEmpty() && allowed.stream().noneMatch(t -> t.accepts(arg))) {
                throw mismatch(predicate, "args[" + i + "] is " + arg.kind().getValue() + " but the declaration bounds it to "
                    + allowed.stream().map(ValueType::symbol).collect(Collectors.joining(" or ")));
            }
        }
    }

    private static FactTypeMismatchException mismatch(String predicate, String message) {
        log.warn("Rejected fact for {}: {}", predicate, message);
        return new FactTypeMismatchException(predicate, message);
    }
}
