package io.uvlanalyzer.core.encoding;

import io.uvlanalyzer.core.model.Expression;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers constraint expressions into clauses over a {@link VariableMap}.
 *
 * <p>
 * The expression is first put into negation normal form with constants folded, then
 * distributed into CNF. When distribution would produce more than {@code clauseLimit} clauses
 * for one expression, the converter falls back to a Tseitin encoding: every compound
 * subformula gets a fresh auxiliary variable bound to it by full equivalence. Auxiliary
 * variables are numbered after the feature variables and each one is a function of the
 * feature variables, so the number of satisfying feature assignments does not change.
 *
 * <p>
 * Not thread-safe: one converter serves one encoding run and owns its auxiliary counter.
 */
public final class CnfConverter {

    private static final Logger LOG = LoggerFactory.getLogger(CnfConverter.class);

    /** Clause budget per expression before switching to the Tseitin encoding. */
    public static final int DEFAULT_CLAUSE_LIMIT = 256;

    private final VariableMap variables;
    private final int clauseLimit;
    private int nextVariable;

    public CnfConverter(VariableMap variables) {
        this(variables, DEFAULT_CLAUSE_LIMIT);
    }

    public CnfConverter(VariableMap variables, int clauseLimit) {
        if (clauseLimit < 1) {
            throw new IllegalArgumentException("clauseLimit must be > 0, got: " + clauseLimit);
        }
        this.variables = variables;
        this.clauseLimit = clauseLimit;
        this.nextVariable = variables.size() + 1;
    }

    /** Feature variables plus every auxiliary variable allocated so far. */
    public int variableCount() {
        return nextVariable - 1;
    }

    /**
     * Converts one expression into an equisatisfiable clause list that preserves the count of
     * satisfying feature assignments.
     *
     * @param expression expression over names known to the variable map
     * @return the clauses; empty for a tautology, a single empty clause for a contradiction
     */
    public List<int[]> convert(Expression expression) {
        Expression nnf = toNnf(expression, false);
        List<int[]> clauses = distribute(nnf);
        if (clauses != null) {
            return clauses;
        }
        int before = nextVariable;
        List<int[]> encoded = tseitin(nnf);
        LOG.debug(
                "cnf.tseitin_fallback clause_limit={} auxiliary_variables={} clauses={}",
                clauseLimit,
                nextVariable - before,
                encoded.size());
        return encoded;
    }

    // --- Negation normal form ---

    /** Pushes negations to the literals and folds constants; {@code negated} flips the result. */
    static Expression toNnf(Expression expression, boolean negated) {
        if (expression instanceof Expression.Literal) {
            return negated ? new Expression.Not(expression) : expression;
        }
        if (expression instanceof Expression.Constant constant) {
            return constant.value() != negated ? Expression.Constant.TRUE : Expression.Constant.FALSE;
        }
        if (expression instanceof Expression.Not not) {
            return toNnf(not.operand(), !negated);
        }
        if (expression instanceof Expression.And and) {
            List<Expression> operands = and.operands().stream().map(e -> toNnf(e, negated)).toList();
            return negated ? or(operands) : and(operands);
        }
        if (expression instanceof Expression.Or or) {
            List<Expression> operands = or.operands().stream().map(e -> toNnf(e, negated)).toList();
            return negated ? and(operands) : or(operands);
        }
        if (expression instanceof Expression.Implies implies) {
            // a => b is !a | b; its negation is a & !b
            return negated
                    ? and(List.of(toNnf(implies.left(), false), toNnf(implies.right(), true)))
                    : or(List.of(toNnf(implies.left(), true), toNnf(implies.right(), false)));
        }
        if (expression instanceof Expression.Equivalent equivalent) {
            Expression left = equivalent.left();
            Expression right = equivalent.right();
            if (negated) {
                return and(List.of(
                        or(List.of(toNnf(left, false), toNnf(right, false))),
                        or(List.of(toNnf(left, true), toNnf(right, true)))));
            }
            return and(List.of(
                    or(List.of(toNnf(left, true), toNnf(right, false))),
                    or(List.of(toNnf(left, false), toNnf(right, true)))));
        }
        throw new IllegalStateException("unhandled expression type: " + expression.getClass().getName());
    }

    private static Expression and(List<Expression> operands) {
        List<Expression> flat = new ArrayList<>();
        for (Expression operand : operands) {
            if (operand.equals(Expression.Constant.FALSE)) {
                return Expression.Constant.FALSE;
            }
            if (operand.equals(Expression.Constant.TRUE)) {
                continue;
            }
            if (operand instanceof Expression.And nested) {
                flat.addAll(nested.operands());
            } else {
                flat.add(operand);
            }
        }
        if (flat.isEmpty()) {
            return Expression.Constant.TRUE;
        }
        return flat.size() == 1 ? flat.get(0) : new Expression.And(flat);
    }

    private static Expression or(List<Expression> operands) {
        List<Expression> flat = new ArrayList<>();
        for (Expression operand : operands) {
            if (operand.equals(Expression.Constant.TRUE)) {
                return Expression.Constant.TRUE;
            }
            if (operand.equals(Expression.Constant.FALSE)) {
                continue;
            }
            if (operand instanceof Expression.Or nested) {
                flat.addAll(nested.operands());
            } else {
                flat.add(operand);
            }
        }
        if (flat.isEmpty()) {
            return Expression.Constant.FALSE;
        }
        return flat.size() == 1 ? flat.get(0) : new Expression.Or(flat);
    }

    // --- Distribution ---

    /** Returns the clauses of an NNF expression, or {@code null} when they exceed the limit. */
    private List<int[]> distribute(Expression nnf) {
        if (nnf instanceof Expression.Constant constant) {
            return constant.value() ? new ArrayList<>() : new ArrayList<>(List.of(new int[0]));
        }
        if (nnf instanceof Expression.Literal || nnf instanceof Expression.Not) {
            return new ArrayList<>(List.of(new int[] {literal(nnf)}));
        }
        if (nnf instanceof Expression.And and) {
            List<int[]> clauses = new ArrayList<>();
            for (Expression operand : and.operands()) {
                List<int[]> part = distribute(operand);
                if (part == null || clauses.size() + part.size() > clauseLimit) {
                    return null;
                }
                clauses.addAll(part);
            }
            return clauses;
        }
        if (nnf instanceof Expression.Or or) {
            List<int[]> product = new ArrayList<>(List.of(new int[0]));
            for (Expression operand : or.operands()) {
                List<int[]> part = distribute(operand);
                if (part == null || (long) product.size() * part.size() > clauseLimit) {
                    return null;
                }
                List<int[]> next = new ArrayList<>(product.size() * part.size());
                for (int[] left : product) {
                    for (int[] right : part) {
                        int[] merged = merge(left, right);
                        if (merged != null) {
                            next.add(merged);
                        }
                    }
                }
                product = next;
            }
            return product;
        }
        throw new IllegalStateException("expression is not in negation normal form: " + nnf);
    }

    /** Union of two clauses, or {@code null} if the union is a tautology. */
    private static int[] merge(int[] left, int[] right) {
        Set<Integer> literals = new LinkedHashSet<>();
        for (int literal : left) {
            literals.add(literal);
        }
        for (int literal : right) {
            if (literals.contains(-literal)) {
                return null;
            }
            literals.add(literal);
        }
        return literals.stream().mapToInt(Integer::intValue).toArray();
    }

    // --- Tseitin ---

    private List<int[]> tseitin(Expression nnf) {
        List<int[]> clauses = new ArrayList<>();
        List<Expression> conjuncts = nnf instanceof Expression.And and ? and.operands() : List.of(nnf);
        for (Expression conjunct : conjuncts) {
            clauses.add(new int[] {define(conjunct, clauses)});
        }
        return clauses;
    }

    /** Returns a literal equivalent to the subformula, adding defining clauses as needed. */
    private int define(Expression nnf, List<int[]> clauses) {
        if (nnf instanceof Expression.Literal || nnf instanceof Expression.Not) {
            return literal(nnf);
        }
        if (nnf instanceof Expression.And and) {
            int[] operands = and.operands().stream().mapToInt(e -> define(e, clauses)).toArray();
            int gate = nextVariable++;
            int[] back = new int[operands.length + 1];
            back[0] = gate;
            for (int i = 0; i < operands.length; i++) {
                clauses.add(new int[] {-gate, operands[i]});
                back[i + 1] = -operands[i];
            }
            clauses.add(back);
            return gate;
        }
        if (nnf instanceof Expression.Or or) {
            int[] operands = or.operands().stream().mapToInt(e -> define(e, clauses)).toArray();
            int gate = nextVariable++;
            int[] forward = new int[operands.length + 1];
            forward[0] = -gate;
            for (int i = 0; i < operands.length; i++) {
                clauses.add(new int[] {gate, -operands[i]});
                forward[i + 1] = operands[i];
            }
            clauses.add(forward);
            return gate;
        }
        throw new IllegalStateException("unexpected subformula in Tseitin encoding: " + nnf);
    }

    private int literal(Expression nnf) {
        if (nnf instanceof Expression.Literal literal) {
            return variables.variable(literal.name());
        }
        if (nnf instanceof Expression.Not not && not.operand() instanceof Expression.Literal literal) {
            return -variables.variable(literal.name());
        }
        throw new IllegalStateException("not a literal: " + nnf);
    }
}
