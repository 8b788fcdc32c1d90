// # Finite-state automata
//
// An automaton here is a plain graph: integer states, string symbols on the edges, a start state and a set of accepting
// states. Each (state, symbol) pair maps to a set of successor states, which lets the same class represent both
// deterministic and non-deterministic automata. Adding a second successor for an existing (state, symbol) pair makes
// the automaton non-deterministic.
//
// There is no sink state. A symbol without a transition rejects the input immediately.
//
// The two interesting operations are `buildTrie`, which turns a finite word list into a tree-shaped automaton sharing
// common prefixes, and `minimize`, which merges equivalent states by partition refinement so that common suffixes are
// shared as well.
package spelling.automaton;

import spelling.Symbols;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

public class Automaton {

    private boolean deterministic;
    private Map<Integer, SortedMap<String, SortedSet<Integer>>> transitions;
    private Integer startState;
    private SortedSet<Integer> states;
    private SortedSet<Integer> accepting;
    private int nextState;

    public Automaton() {
        reset();
    }

    private void reset() {
        deterministic = true;
        transitions = new HashMap<>();
        startState = null;
        states = new TreeSet<>();
        accepting = new TreeSet<>();
        nextState = 0;
    }

    // ## Building

    /**
     * Adds a transition to a newly allocated state and returns that state.
     */
    public int addTransition(int from, String symbol) {
        return addTransition(from, symbol, false);
    }

    /**
     * Adds a transition to a newly allocated state, optionally marking it accepting, and returns that state.
     */
    public int addTransition(int from, String symbol, boolean markAccepting) {
        registerState(from);
        return addTransition(from, symbol, freshState(), markAccepting);
    }

    public int addTransition(int from, String symbol, int to) {
        return addTransition(from, symbol, to, false);
    }

    /**
     * Adds a transition from {@code from} to {@code to} on {@code symbol}. The first transition ever added fixes the start
     * state.
     *
     * @return {@code to}
     */
    public int addTransition(int from, String symbol, int to, boolean markAccepting) {
        if (from < 0 || to < 0) {
            throw new IllegalArgumentException("States must be non-negative, got " + from + " -> " + to);
        }
        if (startState == null) {
            startState = from;
        }
        registerState(from);
        registerState(to);
        SortedSet<Integer> targets = transitions
                .computeIfAbsent(from, k -> new TreeMap<>())
                .computeIfAbsent(symbol, k -> new TreeSet<>());
        targets.add(to);
        if (targets.size() > 1) {
            deterministic = false;
        }
        if (markAccepting) {
            accepting.add(to);
        }
        return to;
    }

    public void markAccepting(int state) {
        registerState(state);
        accepting.add(state);
    }

    /**
     * Declares the start state explicitly, for automata whose first transition does not leave from it.
     */
    public void setStartState(int state) {
        registerState(state);
        startState = state;
    }

    private void registerState(int state) {
        states.add(state);
    }

    // Smallest id not in use. States are never removed outside reset and minimize, so the answer only grows and the
    // scan can resume where it last stopped.
    private int freshState() {
        while (states.contains(nextState)) {
            nextState++;
        }
        return nextState;
    }

    // ## Reading

    /**
     * Returns the states reachable from the start state on {@code symbol}.
     */
    public Set<Integer> move(String symbol) {
        if (startState == null) {
            return Collections.emptySet();
        }
        return move(symbol, startState);
    }

    /**
     * Returns the states reachable from {@code from} on {@code symbol}. An empty set means there is no such transition.
     */
    public Set<Integer> move(String symbol, int from) {
        SortedMap<String, SortedSet<Integer>> outgoing = transitions.get(from);
        if (outgoing == null) {
            return Collections.emptySet();
        }
        SortedSet<Integer> targets = outgoing.get(symbol);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
    }

    public boolean recognize(String word) {
        if (startState == null) {
            return false;
        }
        List<String> symbols = Symbols.split(word);
        return deterministic ? recognizeDeterministic(symbols) : recognizeNonDeterministic(symbols);
    }

    private boolean recognizeDeterministic(List<String> symbols) {
        int state = startState;
        for (String symbol : symbols) {
            Set<Integer> next = move(symbol, state);
            if (next.isEmpty()) {
                return false;
            }
            state = next.iterator().next();
        }
        return accepting.contains(state);
    }

    // Depth-first search over (state, position) pairs. We stop at the first path that ends in an accepting state.
    private boolean recognizeNonDeterministic(List<String> symbols) {
        Deque<int[]> agenda = new ArrayDeque<>();
        agenda.push(new int[]{startState, 0});
        while (agenda.isEmpty() == false) {
            int[] item = agenda.pop();
            int state = item[0];
            int position = item[1];
            if (position == symbols.size()) {
                if (accepting.contains(state)) {
                    return true;
                }
                continue;
            }
            for (int next : move(symbols.get(position), state)) {
                agenda.push(new int[]{next, position + 1});
            }
        }
        return false;
    }

    public boolean isDeterministic() {
        return deterministic;
    }

    public boolean isAccepting(int state) {
        return accepting.contains(state);
    }

    /**
     * Returns the start state, or -1 if nothing has been added yet.
     */
    public int startState() {
        return startState == null ? -1 : startState;
    }

    public SortedSet<Integer> states() {
        return Collections.unmodifiableSortedSet(states);
    }

    public SortedSet<Integer> acceptingStates() {
        return Collections.unmodifiableSortedSet(accepting);
    }

    public SortedSet<String> alphabet() {
        SortedSet<String> alphabet = new TreeSet<>();
        for (SortedMap<String, SortedSet<Integer>> outgoing : transitions.values()) {
            alphabet.addAll(outgoing.keySet());
        }
        return alphabet;
    }

    /**
     * Outgoing transitions of {@code state}, keyed by symbol.
     */
    public SortedMap<String, SortedSet<Integer>> transitions(int state) {
        SortedMap<String, SortedSet<Integer>> outgoing = transitions.get(state);
        return outgoing == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(outgoing);
    }

    public int numTransitions() {
        int total = 0;
        for (SortedMap<String, SortedSet<Integer>> outgoing : transitions.values()) {
            for (SortedSet<Integer> targets : outgoing.values()) {
                total += targets.size();
            }
        }
        return total;
    }

    // ## Tries
    //
    // Words are inserted one at a time. We follow existing transitions for as long as the word's prefix is already
    // present and only append new states from the first symbol that diverges. The state reached at the end of each word
    // becomes accepting, even when it is an interior state of a longer word inserted earlier ("walk" after "walks").

    /**
     * Replaces the contents of this automaton with a trie accepting exactly {@code words}.
     */
    public void buildTrie(Collection<String> words) {
        reset();
        deterministic = true;
        startState = 0;
        registerState(0);
        for (String word : words) {
            int state = startState;
            for (String symbol : Symbols.split(word)) {
                Set<Integer> next = move(symbol, state);
                state = next.isEmpty() ? addTransition(state, symbol) : next.iterator().next();
            }
            accepting.add(state);
        }
    }

    // ## Minimization
    //
    // Two states are equivalent when exactly the same suffixes lead from them to acceptance. We find the equivalence
    // classes by partition refinement: start from the blocks {accepting} and {non-accepting}, then split every block by
    // the "signature" of its states, i.e. the (symbol, block of successor) pairs of their outgoing transitions under the
    // current partition. Splitting can only increase the number of blocks, and that number is bounded by the number of
    // states, so once a pass leaves the number of blocks unchanged the partition is stable.
    //
    // Each final block becomes a single state. Blocks are numbered in a canonical order (start block first, then by
    // smallest member) so that minimizing twice yields the same automaton.

    /**
     * Minimizes this deterministic automaton in place.
     *
     * @throws IllegalStateException if the automaton is not deterministic
     */
    public void minimize() {
        if (deterministic == false) {
            throw new IllegalStateException("Only deterministic automata can be minimized");
        }
        if (startState == null) {
            return;
        }

        List<SortedSet<Integer>> partition = new ArrayList<>();
        SortedSet<Integer> nonAccepting = new TreeSet<>(states);
        nonAccepting.removeAll(accepting);
        SortedSet<Integer> acceptingBlock = new TreeSet<>(accepting);
        acceptingBlock.retainAll(states);
        if (nonAccepting.isEmpty() == false) {
            partition.add(nonAccepting);
        }
        if (acceptingBlock.isEmpty() == false) {
            partition.add(acceptingBlock);
        }

        while (true) {
            Map<Integer, Integer> blockOf = blockIndex(partition);
            List<SortedSet<Integer>> refined = new ArrayList<>();
            for (SortedSet<Integer> block : partition) {
                Map<List<String>, SortedSet<Integer>> bySignature = new LinkedHashMap<>();
                for (int state : block) {
                    bySignature.computeIfAbsent(signature(state, blockOf), k -> new TreeSet<>()).add(state);
                }
                refined.addAll(bySignature.values());
            }
            boolean stable = refined.size() == partition.size();
            partition = refined;
            if (stable) {
                break;
            }
        }

        int start = startState;
        partition.sort(Comparator
                .comparing((SortedSet<Integer> block) -> block.contains(start) == false)
                .thenComparing(SortedSet::first));
        Map<Integer, Integer> blockOf = blockIndex(partition);

        Map<Integer, SortedMap<String, SortedSet<Integer>>> minimizedTransitions = new HashMap<>();
        SortedSet<Integer> minimizedStates = new TreeSet<>();
        SortedSet<Integer> minimizedAccepting = new TreeSet<>();
        for (int i = 0; i < partition.size(); i++) {
            minimizedStates.add(i);
            // Every member of a block has the same signature, so any one of them describes the block.
            int representative = partition.get(i).first();
            if (accepting.contains(representative)) {
                minimizedAccepting.add(i);
            }
            SortedMap<String, SortedSet<Integer>> outgoing = transitions.get(representative);
            if (outgoing == null) {
                continue;
            }
            SortedMap<String, SortedSet<Integer>> merged = new TreeMap<>();
            for (Map.Entry<String, SortedSet<Integer>> edge : outgoing.entrySet()) {
                SortedSet<Integer> target = new TreeSet<>();
                target.add(blockOf.get(edge.getValue().first()));
                merged.put(edge.getKey(), target);
            }
            minimizedTransitions.put(i, merged);
        }

        transitions = minimizedTransitions;
        states = minimizedStates;
        accepting = minimizedAccepting;
        startState = blockOf.get(start);
        nextState = partition.size();
    }

    private static Map<Integer, Integer> blockIndex(List<SortedSet<Integer>> partition) {
        Map<Integer, Integer> blockOf = new HashMap<>();
        for (int i = 0; i < partition.size(); i++) {
            for (int state : partition.get(i)) {
                blockOf.put(state, i);
            }
        }
        return blockOf;
    }

    // Transitions are kept sorted by symbol, so the list doubles as a canonical key.
    private List<String> signature(int state, Map<Integer, Integer> blockOf) {
        SortedMap<String, SortedSet<Integer>> outgoing = transitions.get(state);
        if (outgoing == null) {
            return Collections.emptyList();
        }
        List<String> signature = new ArrayList<>(outgoing.size() * 2);
        for (Map.Entry<String, SortedSet<Integer>> edge : outgoing.entrySet()) {
            signature.add(edge.getKey());
            signature.add(Integer.toString(blockOf.get(edge.getValue().first())));
        }
        return signature;
    }

    // ## Visualization
    //
    // If you have Graphviz installed, save the output as `lexicon.dot` and run `dot -Tpng lexicon.dot -o lexicon.png`.
    public String toDot() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph Automaton {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  start [style=invis];\n");
        sb.append("  node [shape=circle];\n");
        if (startState != null) {
            sb.append("  start -> \"").append(startState).append("\";\n");
        }
        List<Integer> ordered = new ArrayList<>(states);
        if (startState != null) {
            ordered.remove(startState);
            ordered.add(0, startState);
        }
        for (int state : ordered) {
            for (Map.Entry<String, SortedSet<Integer>> edge : transitions(state).entrySet()) {
                for (int target : edge.getValue()) {
                    sb.append("  \"").append(state).append("\" -> \"").append(target)
                            .append("\" [label=\"").append(Symbols.display(edge.getKey())).append("\"];\n");
                }
            }
        }
        for (int state : accepting) {
            sb.append("  \"").append(state).append("\" [shape=doublecircle];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }
}
