package io.uvlanalyzer.core.solver;

import io.uvlanalyzer.core.encoding.Cnf;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Exact model counter: DPLL search with unit propagation, decomposition into variable-disjoint
 * components and a cache of component counts.
 *
 * <p>
 * Counts range over all variables of the {@link Cnf}. Auxiliary variables are functionally
 * determined by the feature variables, so the result equals the number of valid
 * configurations. The component cache is keyed by the residual clause set and survives across
 * calls, which makes repeated counts under different assumptions on one model cheap.
 *
 * <p>
 * Not thread-safe.
 */
public final class ModelCounter {

    private static final Comparator<int[]> CLAUSE_ORDER = Arrays::compare;

    private final Cnf cnf;
    private final Deadline deadline;
    private final Map<String, BigInteger> cache = new HashMap<>();

    public ModelCounter(Cnf cnf, Deadline deadline) {
        this.cnf = cnf;
        this.deadline = deadline;
    }

    /**
     * Counts the assignments satisfying the clauses and every given unit literal.
     *
     * @param units literals to conjoin, may be empty
     * @return the exact count, {@code 0} when unsatisfiable
     */
    public BigInteger count(int... units) {
        List<int[]> clauses = cnf.clauses();
        for (int unit : units) {
            if (unit == 0 || Math.abs(unit) > cnf.variableCount()) {
                throw new IllegalStateException("unit literal " + unit + " is outside the declared variables");
            }
            clauses.add(new int[] {unit});
        }
        BitSet free = new BitSet(cnf.variableCount() + 1);
        free.set(1, cnf.variableCount() + 1);
        return count(clauses, free);
    }

    /** Number of cached components, exposed for diagnostics. */
    public int cacheSize() {
        return cache.size();
    }

    /**
     * Counts models of {@code clauses} over the unassigned variables in {@code scope}. Variables
     * in scope that occur in no clause are free and double the count.
     *
     * <p>
     * Branching runs on an explicit stack of {@link Frame}s, so the search depth is bounded by
     * the heap rather than the thread stack.
     */
    private BigInteger count(List<int[]> clauses, BitSet scope) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new CountFrame(clauses, scope));
        BigInteger returned = null;
        while (!stack.isEmpty()) {
            deadline.check();
            Frame top = stack.peek();
            Frame child = top.resume(returned);
            returned = null;
            if (child != null) {
                stack.push(child);
            } else {
                stack.pop();
                returned = top.result();
            }
        }
        return returned;
    }

    /** One suspended step of the search. */
    private interface Frame {

        /**
         * Continues with the result of the last finished child, {@code null} on the first call.
         *
         * @return the next child to run, or {@code null} once {@link #result()} is final
         */
        Frame resume(BigInteger childResult);

        BigInteger result();
    }

    /** Propagates units, then multiplies the counts of the independent components. */
    private final class CountFrame implements Frame {

        private final List<int[]> clauses;
        private final BitSet scope;
        private Iterator<List<int[]>> pending;
        private BigInteger result;

        CountFrame(List<int[]> clauses, BitSet scope) {
            this.clauses = clauses;
            this.scope = scope;
        }

        @Override
        public Frame resume(BigInteger childResult) {
            if (pending == null) {
                return start();
            }
            if (childResult.signum() == 0) {
                result = BigInteger.ZERO;
                return null;
            }
            result = result.multiply(childResult);
            return next();
        }

        private Frame start() {
            List<int[]> current = clauses;
            BitSet unassigned = (BitSet) scope.clone();

            int[] unit;
            while ((unit = findUnit(current)) != null) {
                if (unit.length == 0) {
                    result = BigInteger.ZERO;
                    return null;
                }
                current = assign(current, unit[0]);
                if (current == null) {
                    result = BigInteger.ZERO;
                    return null;
                }
                unassigned.clear(Math.abs(unit[0]));
            }

            if (current.isEmpty()) {
                result = BigInteger.TWO.pow(unassigned.cardinality());
                return null;
            }

            BitSet constrained = new BitSet();
            for (int[] clause : current) {
                for (int literal : clause) {
                    constrained.set(Math.abs(literal));
                }
            }
            BitSet free = (BitSet) unassigned.clone();
            free.andNot(constrained);

            result = BigInteger.TWO.pow(free.cardinality());
            pending = components(current).iterator();
            return next();
        }

        private Frame next() {
            return pending.hasNext() ? new ComponentFrame(pending.next()) : null;
        }

        @Override
        public BigInteger result() {
            return result;
        }
    }

    /** Branches on the most frequent variable of one component and caches the sum. */
    private final class ComponentFrame implements Frame {

        private final List<int[]> component;
        private String key;
        private BitSet rest;
        private int[] literals;
        private int nextLiteral;
        private BigInteger total;

        ComponentFrame(List<int[]> component) {
            this.component = component;
        }

        @Override
        public Frame resume(BigInteger childResult) {
            if (key == null) {
                return start();
            }
            total = total.add(childResult);
            return next();
        }

        private Frame start() {
            key = key(component);
            BigInteger cached = cache.get(key);
            if (cached != null) {
                total = cached;
                return null;
            }
            BitSet variables = new BitSet();
            int[] occurrences = new int[cnf.variableCount() + 1];
            for (int[] clause : component) {
                for (int literal : clause) {
                    variables.set(Math.abs(literal));
                    occurrences[Math.abs(literal)]++;
                }
            }
            int branch = variables.nextSetBit(0);
            for (int variable = variables.nextSetBit(0);
                    variable >= 0;
                    variable = variables.nextSetBit(variable + 1)) {
                if (occurrences[variable] > occurrences[branch]) {
                    branch = variable;
                }
            }
            rest = (BitSet) variables.clone();
            rest.clear(branch);
            literals = new int[] {branch, -branch};
            total = BigInteger.ZERO;
            return next();
        }

        private Frame next() {
            while (nextLiteral < literals.length) {
                List<int[]> reduced = assign(component, literals[nextLiteral++]);
                if (reduced != null) {
                    return new CountFrame(reduced, rest);
                }
            }
            cache.put(key, total);
            return null;
        }

        @Override
        public BigInteger result() {
            return total;
        }
    }

    /** Returns the first unit or empty clause, or {@code null} if there is none. */
    private static int[] findUnit(List<int[]> clauses) {
        for (int[] clause : clauses) {
            if (clause.length <= 1) {
                return clause;
            }
        }
        return null;
    }

    /**
     * Simplifies the clauses under a literal: satisfied clauses are dropped and the opposite
     * literal is removed. Returns {@code null} on an empty clause.
     */
    private static List<int[]> assign(List<int[]> clauses, int literal) {
        List<int[]> result = new ArrayList<>(clauses.size());
        for (int[] clause : clauses) {
            boolean satisfied = false;
            boolean shrinks = false;
            for (int l : clause) {
                if (l == literal) {
                    satisfied = true;
                    break;
                }
                if (l == -literal) {
                    shrinks = true;
                }
            }
            if (satisfied) {
                continue;
            }
            if (!shrinks) {
                result.add(clause);
                continue;
            }
            int[] reduced = Arrays.stream(clause).filter(l -> l != -literal).toArray();
            if (reduced.length == 0) {
                return null;
            }
            result.add(reduced);
        }
        return result;
    }

    /** Splits clauses into groups that share no variable. */
    private List<List<int[]>> components(List<int[]> clauses) {
        int[] parent = new int[cnf.variableCount() + 1];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (int[] clause : clauses) {
            int first = Math.abs(clause[0]);
            for (int i = 1; i < clause.length; i++) {
                union(parent, first, Math.abs(clause[i]));
            }
        }
        Map<Integer, List<int[]>> byRoot = new HashMap<>();
        List<List<int[]>> components = new ArrayList<>();
        for (int[] clause : clauses) {
            int root = find(parent, Math.abs(clause[0]));
            List<int[]> component = byRoot.get(root);
            if (component == null) {
                component = new ArrayList<>();
                byRoot.put(root, component);
                components.add(component);
            }
            component.add(clause);
        }
        return components;
    }

    private static int find(int[] parent, int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) {
            parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
        }
    }

    /** Canonical text of a component: sorted literals in sorted clauses. */
    private static String key(List<int[]> component) {
        List<int[]> sorted = new ArrayList<>(component.size());
        for (int[] clause : component) {
            int[] copy = clause.clone();
            Arrays.sort(copy);
            sorted.add(copy);
        }
        sorted.sort(CLAUSE_ORDER);
        StringBuilder key = new StringBuilder();
        for (int[] clause : sorted) {
            for (int literal : clause) {
                key.append(literal).append(' ');
            }
            key.append('|');
        }
        return key.toString();
    }
}
