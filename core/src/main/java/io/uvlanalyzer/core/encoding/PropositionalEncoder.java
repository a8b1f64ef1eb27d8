package io.uvlanalyzer.core.encoding;

import io.uvlanalyzer.core.error.MalformedModelException;
import io.uvlanalyzer.core.model.Constraint;
import io.uvlanalyzer.core.model.Expression;
import io.uvlanalyzer.core.model.Feature;
import io.uvlanalyzer.core.model.FeatureModel;
import io.uvlanalyzer.core.model.FeatureTree;
import io.uvlanalyzer.core.model.Group;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a {@link FeatureModel} into its validity formula.
 *
 * <p>
 * Rules, with {@code p} the parent and {@code c} each child of a group:
 *
 * <ul>
 * <li>root: unit clause;
 * <li>mandatory: {@code p <=> c};
 * <li>optional: {@code c => p};
 * <li>or: {@code p <=> (c1 | ... | cn)};
 * <li>alternative: as or, plus {@code !(ci & cj)} for every pair;
 * <li>cardinality {@code [l..u]}: {@code c => p}; {@code p} implies a child out of every
 *     {@code k - l + 1} children, and no {@code u + 1} children are selected together.
 * </ul>
 *
 * Tree rules become clauses directly; constraints go through {@link CnfConverter}. Features are
 * visited in declaration order and constraints in source order, so the same model always yields
 * the same numbering and the same clause list.
 */
public final class PropositionalEncoder {

    private static final Logger LOG = LoggerFactory.getLogger(PropositionalEncoder.class);

    /** Most clauses one cardinality group may expand into. */
    static final long MAX_CARDINALITY_CLAUSES = 100_000;

    private final int clauseLimit;

    public PropositionalEncoder() {
        this(CnfConverter.DEFAULT_CLAUSE_LIMIT);
    }

    /**
     * @param clauseLimit per-constraint clause budget before the Tseitin fallback
     */
    public PropositionalEncoder(int clauseLimit) {
        this.clauseLimit = clauseLimit;
    }

    /**
     * Encodes a model.
     *
     * @param model a parsed model
     * @return its validity formula
     */
    public EncodedFormula encode(FeatureModel model) {
        long start = System.nanoTime();
        FeatureTree tree = model.tree();
        VariableMap variables = new VariableMap(tree.variableOrder());
        List<int[]> clauses = new ArrayList<>();
        List<Expression> conjuncts = new ArrayList<>();

        String root = tree.root().name();
        clauses.add(new int[] {variables.variable(root)});
        conjuncts.add(new Expression.Literal(root));

        for (Feature feature : tree.features()) {
            for (Group group : feature.groups()) {
                encodeGroup(feature, group, variables, clauses, conjuncts);
            }
        }

        CnfConverter converter = new CnfConverter(variables, clauseLimit);
        for (Constraint constraint : model.constraints()) {
            clauses.addAll(converter.convert(constraint.expression()));
            conjuncts.add(constraint.expression());
        }

        Cnf cnf = new Cnf(variables.size(), converter.variableCount(), clauses);
        LOG.debug(
                "encoding.completed features={} variables={} clauses={} duration_us={}",
                variables.size(),
                cnf.variableCount(),
                cnf.clauseCount(),
                (System.nanoTime() - start) / 1_000);
        return new EncodedFormula(new Expression.And(conjuncts), cnf, variables);
    }

    private static void encodeGroup(
            Feature parentFeature,
            Group group,
            VariableMap variables,
            List<int[]> clauses,
            List<Expression> conjuncts) {
        String parent = parentFeature.name();
        int p = variables.variable(parent);
        Expression parentLiteral = new Expression.Literal(parent);
        List<String> children = group.children();
        int[] childVars = children.stream().mapToInt(variables::variable).toArray();
        List<Expression> childLiterals =
                children.stream().<Expression>map(Expression.Literal::new).toList();

        switch (group.kind()) {
            case MANDATORY -> {
                for (int i = 0; i < childVars.length; i++) {
                    clauses.add(new int[] {-p, childVars[i]});
                    clauses.add(new int[] {-childVars[i], p});
                    conjuncts.add(new Expression.Equivalent(parentLiteral, childLiterals.get(i)));
                }
            }
            case OPTIONAL -> {
                for (int i = 0; i < childVars.length; i++) {
                    clauses.add(new int[] {-childVars[i], p});
                    conjuncts.add(new Expression.Implies(childLiterals.get(i), parentLiteral));
                }
            }
            case OR -> encodeDisjunction(p, childVars, clauses, conjuncts, parentLiteral, childLiterals);
            case ALTERNATIVE -> {
                encodeDisjunction(p, childVars, clauses, conjuncts, parentLiteral, childLiterals);
                for (int i = 0; i < childVars.length; i++) {
                    for (int j = i + 1; j < childVars.length; j++) {
                        clauses.add(new int[] {-childVars[i], -childVars[j]});
                        conjuncts.add(new Expression.Not(
                                new Expression.And(childLiterals.get(i), childLiterals.get(j))));
                    }
                }
            }
            case CARDINALITY -> {
                long expansion = cardinalityClauses(group);
                if (expansion > MAX_CARDINALITY_CLAUSES) {
                    throw new MalformedModelException(
                            "Group cardinality " + group.describe() + " of feature '" + parent + "' expands to "
                                    + expansion + " clauses (limit " + MAX_CARDINALITY_CLAUSES + ")",
                            parentFeature.line());
                }
                encodeCardinality(p, group, childVars, clauses, conjuncts, parentLiteral, childLiterals);
            }
        }
    }

    /**
     * {@code c => p} for every child, then the bounds as subset clauses: every
     * {@code k - l + 1} children hold a selected one when {@code p} is, and every
     * {@code u + 1} children hold an unselected one.
     */
    private static void encodeCardinality(
            int p,
            Group group,
            int[] childVars,
            List<int[]> clauses,
            List<Expression> conjuncts,
            Expression parentLiteral,
            List<Expression> childLiterals) {
        int k = childVars.length;
        for (int i = 0; i < k; i++) {
            clauses.add(new int[] {-childVars[i], p});
            conjuncts.add(new Expression.Implies(childLiterals.get(i), parentLiteral));
        }
        if (group.lower() > 0) {
            forEachSubset(k, k - group.lower() + 1, subset -> {
                int[] clause = new int[subset.length + 1];
                clause[0] = -p;
                List<Expression> some = new ArrayList<>(subset.length);
                for (int i = 0; i < subset.length; i++) {
                    clause[i + 1] = childVars[subset[i]];
                    some.add(childLiterals.get(subset[i]));
                }
                clauses.add(clause);
                conjuncts.add(new Expression.Implies(parentLiteral, new Expression.Or(some)));
            });
        }
        if (group.upper() < k) {
            forEachSubset(k, group.upper() + 1, subset -> {
                int[] clause = new int[subset.length];
                List<Expression> all = new ArrayList<>(subset.length);
                for (int i = 0; i < subset.length; i++) {
                    clause[i] = -childVars[subset[i]];
                    all.add(childLiterals.get(subset[i]));
                }
                clauses.add(clause);
                conjuncts.add(new Expression.Not(new Expression.And(all)));
            });
        }
    }

    /** Clauses {@link #encodeCardinality} adds for the bounds. */
    static long cardinalityClauses(Group group) {
        int k = group.size();
        long total = 0;
        if (group.lower() > 0) {
            total += binomial(k, k - group.lower() + 1);
        }
        if (group.upper() < k) {
            total += binomial(k, group.upper() + 1);
        }
        return total;
    }

    /** {@code n choose r}, saturating at {@link Long#MAX_VALUE}. */
    private static long binomial(int n, int r) {
        BigInteger result = BigInteger.ONE;
        for (int i = 0; i < r; i++) {
            result = result.multiply(BigInteger.valueOf(n - i)).divide(BigInteger.valueOf(i + 1));
        }
        return result.bitLength() < Long.SIZE ? result.longValue() : Long.MAX_VALUE;
    }

    /** Calls {@code action} with every ascending {@code size}-subset of {@code 0..n-1}. */
    private static void forEachSubset(int n, int size, Consumer<int[]> action) {
        int[] subset = new int[size];
        for (int i = 0; i < size; i++) {
            subset[i] = i;
        }
        while (true) {
            action.accept(subset.clone());
            int i = size - 1;
            while (i >= 0 && subset[i] == n - size + i) {
                i--;
            }
            if (i < 0) {
                return;
            }
            subset[i]++;
            for (int j = i + 1; j < size; j++) {
                subset[j] = subset[j - 1] + 1;
            }
        }
    }

    /** {@code p <=> (c1 | ... | cn)}. */
    private static void encodeDisjunction(
            int p,
            int[] childVars,
            List<int[]> clauses,
            List<Expression> conjuncts,
            Expression parentLiteral,
            List<Expression> childLiterals) {
        int[] forward = new int[childVars.length + 1];
        forward[0] = -p;
        for (int i = 0; i < childVars.length; i++) {
            forward[i + 1] = childVars[i];
            clauses.add(new int[] {-childVars[i], p});
        }
        clauses.add(forward);
        conjuncts.add(new Expression.Equivalent(parentLiteral, new Expression.Or(childLiterals)));
    }
}
