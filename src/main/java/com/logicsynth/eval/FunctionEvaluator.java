package com.logicsynth.eval;

import com.logicsynth.ir.CompositeKind;
import com.logicsynth.ir.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates the scalar and structural built-in functions on ground arguments.
 * Aggregates live in {@link Aggregation}. Anything else yields empty.
 */
public final class FunctionEvaluator {

    private FunctionEvaluator() {}

    public static Optional<Term> apply(String function, List<Term> args) {
        switch (function) {
            case "fn:plus":
            case "fn:float:plus":
                return arithmetic(args, 0, Math::addExact, Double::sum);
            case "fn:mult":
            case "fn:float:mult":
                return arithmetic(args, 1, Math::multiplyExact, (a, b) -> a * b);
            case "fn:minus":
                return minus(args);
            case "fn:div":
            case "fn:float:div":
                return divide(args);
            case "fn:sqrt":
                return args.size() == 1 ? asDouble(args.get(0)).filter(d -> d >= 0)
                    .map(d -> new Term.Float64(Math.sqrt(d))) : Optional.empty();
            case "fn:list":
            case "fn:tuple":
                return Optional.of(new Term.Composite(CompositeKind.LIST, args));
            case "fn:pair":
                return args.size() == 2 ? Optional.of(new Term.Composite(CompositeKind.LIST, args)) : Optional.empty();
            case "fn:map":
                return args.size() % 2 == 0 ? Optional.of(new Term.Composite(CompositeKind.MAP, args)) : Optional.empty();
            case "fn:struct":
                return args.size() % 2 == 0 ? Optional.of(new Term.Composite(CompositeKind.STRUCT, args)) : Optional.empty();
            case "fn:cons":
                return cons(args);
            case "fn:append":
                return append(args);
            case "fn:len":
                return args.size() == 1 ? list(args.get(0)).map(l -> new Term.Number(l.size())) : Optional.empty();
            case "fn:list:get":
                return listGet(args);
            case "fn:list:contains":
                return args.size() == 2
                    ? list(args.get(0)).map(l -> bool(l.contains(args.get(1))))
                    : Optional.empty();
            case "fn:map:get":
            case "fn:struct:get":
                return lookup(args);
            case "fn:string:concat":
                return concat(args);
            case "fn:number:to_string":
                return args.size() == 1 && args.get(0) instanceof Term.Number n
                    ? Optional.of(new Term.Text(Long.toString(n.value()))) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface LongOp {
        long apply(long a, long b);
    }

    @FunctionalInterface
    private interface DoubleOp {
        double apply(double a, double b);
    }

    private static Optional<Term> arithmetic(List<Term> args, long identity, LongOp longOp, DoubleOp doubleOp) {
        if (args.stream().allMatch(a -> a instanceof Term.Number)) {
            long acc = identity;
            try {
                for (Term a : args) {
                    acc = longOp.apply(acc, ((Term.Number) a).value());
                }
            } catch (ArithmeticException ex) {
                return Optional.empty();
            }
            return Optional.of(new Term.Number(acc));
        }
        double acc = identity;
        for (Term a : args) {
            Optional<Double> d = asDouble(a);
            if (d.isEmpty()) {
                return Optional.empty();
            }
            acc = doubleOp.apply(acc, d.get());
        }
        return Optional.of(new Term.Float64(acc));
    }

    private static Optional<Term> minus(List<Term> args) {
        if (args.isEmpty()) {
            return Optional.empty();
        }
        if (args.size() == 1) {
            return negate(args.get(0));
        }
        // a - b - c == a + -(b + c)
        return arithmetic(args.subList(1, args.size()), 0, Math::addExact, Double::sum)
            .flatMap(FunctionEvaluator::negate)
            .flatMap(n -> arithmetic(List.of(args.get(0), n), 0, Math::addExact, Double::sum));
    }

    private static Optional<Term> negate(Term t) {
        if (t instanceof Term.Number n && n.value() != Long.MIN_VALUE) {
            return Optional.of(new Term.Number(-n.value()));
        }
        if (t instanceof Term.Float64 f) {
            return Optional.of(new Term.Float64(-f.value()));
        }
        return Optional.empty();
    }

    private static Optional<Term> divide(List<Term> args) {
        if (args.size() < 2) {
            return Optional.empty();
        }
        if (args.stream().allMatch(a -> a instanceof Term.Number)) {
            long acc = ((Term.Number) args.get(0)).value();
            for (Term a : args.subList(1, args.size())) {
                long divisor = ((Term.Number) a).value();
                if (divisor == 0) {
                    return Optional.empty();
                }
                acc = acc / divisor;
            }
            return Optional.of(new Term.Number(acc));
        }
        Optional<Double> first = asDouble(args.get(0));
        if (first.isEmpty()) {
            return Optional.empty();
        }
        double acc = first.get();
        for (Term a : args.subList(1, args.size())) {
            Optional<Double> d = asDouble(a);
            if (d.isEmpty() || d.get() == 0.0) {
                return Optional.empty();
            }
            acc = acc / d.get();
        }
        return Optional.of(new Term.Float64(acc));
    }

    private static Optional<Term> cons(List<Term> args) {
        if (args.size() != 2) {
            return Optional.empty();
        }
        return list(args.get(1)).map(tail -> {
            List<Term> out = new ArrayList<>();
            out.add(args.get(0));
            out.addAll(tail);
            return new Term.Composite(CompositeKind.LIST, out);
        });
    }

    private static Optional<Term> append(List<Term> args) {
        if (args.isEmpty()) {
            return Optional.empty();
        }
        return list(args.get(0)).map(head -> {
            List<Term> out = new ArrayList<>(head);
            out.addAll(args.subList(1, args.size()));
            return new Term.Composite(CompositeKind.LIST, out);
        });
    }

    private static Optional<Term> listGet(List<Term> args) {
        if (args.size() != 2 || !(args.get(1) instanceof Term.Number index)) {
            return Optional.empty();
        }
        return list(args.get(0))
            .filter(l -> index.value() >= 0 && index.value() < l.size())
            .map(l -> l.get((int) index.value()));
    }

    private static Optional<Term> lookup(List<Term> args) {
        if (args.size() != 2 || !(args.get(0) instanceof Term.Composite c) || !c.compositeKind().requiresPairs()) {
            return Optional.empty();
        }
        for (int i = 0; i + 1 < c.args().size(); i += 2) {
            if (c.args().get(i).equals(args.get(1))) {
                return Optional.of(c.args().get(i + 1));
            }
        }
        return Optional.empty();
    }

    private static Optional<Term> concat(List<Term> args) {
        StringBuilder sb = new StringBuilder();
        for (Term a : args) {
            if (a instanceof Term.Text t) {
                sb.append(t.value());
            } else if (a instanceof Term.Name n) {
                sb.append(n.symbol());
            } else if (a instanceof Term.Number n) {
                sb.append(n.value());
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(new Term.Text(sb.toString()));
    }

    static Optional<List<Term>> list(Term t) {
        if (t instanceof Term.Composite c && c.compositeKind() == CompositeKind.LIST) {
            return Optional.of(c.args());
        }
        return Optional.empty();
    }

    static Optional<Double> asDouble(Term t) {
        if (t instanceof Term.Number n) {
            return Optional.of((double) n.value());
        }
        if (t instanceof Term.Float64 f) {
            return Optional.of(f.value());
        }
        return Optional.empty();
    }

    static Term bool(boolean value) {
        return new Term.Name(value ? "/true" : "/false");
    }
}
