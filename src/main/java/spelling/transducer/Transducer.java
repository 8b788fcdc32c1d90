// # Weighted finite-state transducers
//
// A transducer is an automaton whose transitions carry an input symbol, an output symbol and a weight. Reading a string
// along an accepting path writes the concatenated outputs of the path, at the cost of the summed weights. Weights are
// negative log probabilities, so lower is more probable and path weights add up.
//
// Either label may be epsilon (the empty string). An epsilon input means the transition fires without consuming input,
// an epsilon output means it writes nothing.
//
// The operations we need for spelling correction are:
//
// * `fromAutomaton` to lift a lexicon automaton into an identity transducer,
// * `invert` to swap input and output labels,
// * `compose` to chain two transducers into one, and
// * `transduce` to enumerate the outputs of an input string.
package spelling.transducer;

import spelling.Symbols;
import spelling.automaton.Automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.SortedSet;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.TreeSet;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

public class Transducer {

    private final Map<Integer, Map<String, Set<Arc>>> transitions = new LinkedHashMap<>();
    private final SortedSet<Integer> states = new TreeSet<>();
    private final SortedSet<Integer> accepting = new TreeSet<>();
    private Integer startState;
    private int nextState;

    /**
     * Returns the identity transducer of {@code automaton}: every transition reads and writes the same symbol at weight
     * zero, with the same start and accepting states.
     */
    public static Transducer fromAutomaton(Automaton automaton) {
        Transducer transducer = new Transducer();
        if (automaton.startState() >= 0) {
            transducer.setStartState(automaton.startState());
        }
        for (int state : automaton.states()) {
            transducer.registerState(state);
            automaton.transitions(state).forEach((symbol, targets) -> {
                for (int target : targets) {
                    transducer.addTransition(state, symbol, target, symbol, 0.0, false);
                }
            });
        }
        for (int state : automaton.acceptingStates()) {
            transducer.markAccepting(state);
        }
        return transducer;
    }

    // ## Building

    /**
     * Adds an identity transition at weight zero to a newly allocated state and returns that state.
     */
    public int addTransition(int from, String input) {
        registerState(from);
        return addTransition(from, input, freshState(), input, 0.0, false);
    }

    public int addTransition(int from, String input, int to) {
        return addTransition(from, input, to, input, 0.0, false);
    }

    public int addTransition(int from, String input, int to, String output) {
        return addTransition(from, input, to, output, 0.0, false);
    }

    public int addTransition(int from, String input, int to, String output, double weight) {
        return addTransition(from, input, to, output, weight, false);
    }

    /**
     * Adds a transition {@code from --input:output/weight--> to}. The first transition ever added fixes the start state.
     *
     * @param output output symbol, or {@code null} to copy the input symbol
     * @return {@code to}
     */
    public int addTransition(int from, String input, int to, String output, double weight, boolean markAccepting) {
        Objects.requireNonNull(input, "input");
        if (from < 0 || to < 0) {
            throw new IllegalArgumentException("States must be non-negative, got " + from + " -> " + to);
        }
        if (startState == null) {
            startState = from;
        }
        registerState(from);
        registerState(to);
        transitions.computeIfAbsent(from, k -> new LinkedHashMap<>())
                .computeIfAbsent(input, k -> new LinkedHashSet<>())
                .add(new Arc(output == null ? input : output, to, weight));
        if (markAccepting) {
            accepting.add(to);
        }
        return to;
    }

    public void markAccepting(int state) {
        registerState(state);
        accepting.add(state);
    }

    public void setStartState(int state) {
        registerState(state);
        startState = state;
    }

    private void registerState(int state) {
        states.add(state);
    }

    // Smallest unused id, as in Automaton.
    private int freshState() {
        while (states.contains(nextState)) {
            nextState++;
        }
        return nextState;
    }

    // ## Reading

    public int startState() {
        return startState == null ? -1 : startState;
    }

    public SortedSet<Integer> states() {
        return Collections.unmodifiableSortedSet(states);
    }

    public SortedSet<Integer> acceptingStates() {
        return Collections.unmodifiableSortedSet(accepting);
    }

    public boolean isAccepting(int state) {
        return accepting.contains(state);
    }

    /**
     * Arcs leaving {@code state} on {@code input}, in insertion order. Empty if there are none.
     */
    public Set<Arc> arcs(int state, String input) {
        Map<String, Set<Arc>> outgoing = transitions.get(state);
        if (outgoing == null) {
            return Collections.emptySet();
        }
        Set<Arc> arcs = outgoing.get(input);
        return arcs == null ? Collections.emptySet() : Collections.unmodifiableSet(arcs);
    }

    /**
     * All arcs leaving {@code state}, keyed by input symbol.
     */
    public Map<String, Set<Arc>> transitions(int state) {
        Map<String, Set<Arc>> outgoing = transitions.get(state);
        return outgoing == null ? Collections.emptyMap() : Collections.unmodifiableMap(outgoing);
    }

    public int numArcs() {
        int total = 0;
        for (Map<String, Set<Arc>> outgoing : transitions.values()) {
            for (Set<Arc> arcs : outgoing.values()) {
                total += arcs.size();
            }
        }
        return total;
    }

    // ## Inversion

    /**
     * Returns a new transducer with input and output swapped on every arc. Weights, states, the start state and the
     * accepting states are kept. This transducer is not modified.
     */
    public Transducer invert() {
        Transducer inverted = new Transducer();
        if (startState != null) {
            inverted.setStartState(startState);
        }
        for (int state : states) {
            inverted.registerState(state);
        }
        transitions.forEach((from, outgoing) -> outgoing.forEach((input, arcs) -> {
            for (Arc arc : arcs) {
                inverted.addTransition(from, arc.output(), arc.target(), input, arc.weight(), false);
            }
        }));
        for (int state : accepting) {
            inverted.markAccepting(state);
        }
        return inverted;
    }

    // ## Composition
    //
    // Composing m1 with m2 builds a machine that behaves like feeding each output of m1 into m2. A state of the result
    // is a pair (state of m1, state of m2), and there is an arc between two pairs whenever m1 has an arc writing some
    // symbol x and m2 has an arc reading that same x.
    //
    // We rely on two properties of how the corrector uses this. First, m1 has no epsilon arcs of its own. Second, m1 is
    // unweighted, so the arc weight is simply taken from m2.
    //
    // m2 may read epsilon, i.e. advance without m1 writing anything. To line those arcs up we give every state of m1 an
    // epsilon self-loop first, which lets m1 wait in place while m2 moves.
    //
    // Only pairs reachable from the pair of start states are built, by working through a queue of newly seen pairs.
    //
    // Pairs are numbered through a map from the pair to a fresh id. Gluing the decimal digits together instead would
    // make (1, 23) and (12, 3) the same state.

    /**
     * Returns the composition of {@code m1} followed by {@code m2}. Neither argument is modified.
     */
    public static Transducer compose(Transducer m1, Transducer m2) {
        Transducer waiting = m1.copy();
        for (int state : new ArrayList<>(waiting.states)) {
            waiting.addTransition(state, Symbols.EPSILON, state, Symbols.EPSILON, 0.0, false);
        }

        StatePairing pairing = new StatePairing();
        Transducer composed = new Transducer();
        if (m1.startState == null || m2.startState == null) {
            return composed;
        }
        composed.setStartState(pairedState(composed, pairing, m1, m2, m1.startState, m2.startState));
        Deque<int[]> pending = new ArrayDeque<>();
        pending.add(new int[]{m1.startState, m2.startState});
        while (pending.isEmpty() == false) {
            int[] pair = pending.poll();
            int from = pairing.id(pair[0], pair[1]);
            for (Map.Entry<String, Set<Arc>> outgoing : waiting.transitions(pair[0]).entrySet()) {
                for (Arc arc1 : outgoing.getValue()) {
                    for (Arc arc2 : m2.arcs(pair[1], arc1.output())) {
                        boolean seen = pairing.contains(arc1.target(), arc2.target());
                        int to = pairedState(composed, pairing, m1, m2, arc1.target(), arc2.target());
                        composed.addTransition(from, outgoing.getKey(), to, arc2.output(), arc2.weight(), false);
                        if (seen == false) {
                            pending.add(new int[]{arc1.target(), arc2.target()});
                        }
                    }
                }
            }
        }
        return composed;
    }

    // Registers the pair on first sight, marking it accepting when both halves are accepting.
    private static int pairedState(Transducer composed, StatePairing pairing,
                                   Transducer m1, Transducer m2, int s1, int s2) {
        int id = pairing.id(s1, s2);
        composed.registerState(id);
        if (m1.isAccepting(s1) && m2.isAccepting(s2)) {
            composed.accepting.add(id);
        }
        return id;
    }

    private Transducer copy() {
        Transducer copy = new Transducer();
        if (startState != null) {
            copy.setStartState(startState);
        }
        for (int state : states) {
            copy.registerState(state);
        }
        transitions.forEach((from, outgoing) -> outgoing.forEach((input, arcs) -> {
            for (Arc arc : arcs) {
                copy.addTransition(from, input, arc.target(), arc.output(), arc.weight(), false);
            }
        }));
        copy.accepting.addAll(accepting);
        return copy;
    }

    // ## Transduction
    //
    // We search the transducer with an agenda of (output so far, state, weight so far, input position). From each item
    // we follow the arcs that read the next input symbol, plus the epsilon arcs, which leave the input position where it
    // is. An (output, state, position) triple is only expanded once, which rules out looping on epsilon cycles and
    // repeating work when two paths meet.
    //
    // The agenda is ordered by weight, lightest first. With non-negative weights that makes the first expansion of a
    // triple the cheapest way to reach it, so skipping later arrivals never loses a better path, and results come out
    // best first.
    //
    // A path is reported when it has consumed the whole input in an accepting state and its output differs from the
    // input. Reproducing the input unchanged is never reported, since we are looking for alternatives to it.

    /**
     * Lazily enumerates the accepted outputs of {@code input} with their path weights, lightest first.
     */
    public Stream<Transduction> transduce(String input) {
        Iterator<Transduction> iterator = new TransductionIterator(input);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
    }

    private record AgendaItem(String output, int state, double weight, int position, long order) {
    }

    private record Visit(String output, int state, int position) {
    }

    private static final Comparator<AgendaItem> LIGHTEST_FIRST = Comparator
            .comparingDouble(AgendaItem::weight)
            .thenComparingLong(AgendaItem::order);

    private class TransductionIterator implements Iterator<Transduction> {
        private final String input;
        private final List<String> symbols;
        private final PriorityQueue<AgendaItem> agenda = new PriorityQueue<>(LIGHTEST_FIRST);
        private final Set<Visit> visited = new HashSet<>();
        private long pushed;
        private Transduction next;

        TransductionIterator(String input) {
            this.input = Objects.requireNonNull(input, "input");
            this.symbols = Symbols.split(input);
            if (startState != null) {
                push(Symbols.EPSILON, startState, 0.0, 0);
            }
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Transduction next() {
            if (hasNext() == false) {
                throw new NoSuchElementException();
            }
            Transduction result = next;
            next = null;
            return result;
        }

        private void push(String output, int state, double weight, int position) {
            agenda.add(new AgendaItem(output, state, weight, position, pushed++));
        }

        private Transduction advance() {
            while (agenda.isEmpty() == false) {
                AgendaItem item = agenda.poll();
                if (visited.add(new Visit(item.output(), item.state(), item.position())) == false) {
                    continue;
                }
                for (Arc arc : arcs(item.state(), Symbols.EPSILON)) {
                    push(item.output() + arc.output(), arc.target(), item.weight() + arc.weight(), item.position());
                }
                if (item.position() < symbols.size()) {
                    for (Arc arc : arcs(item.state(), symbols.get(item.position()))) {
                        push(item.output() + arc.output(), arc.target(), item.weight() + arc.weight(),
                                item.position() + 1);
                    }
                } else if (isAccepting(item.state()) && item.output().equals(input) == false) {
                    return new Transduction(item.output(), item.weight());
                }
            }
            return null;
        }
    }

    @Override
    public String toString() {
        return "Transducer{states=" + states.size() + ", arcs=" + numArcs() + ", start=" + startState() + "}";
    }

    /**
     * Injective numbering of state pairs. Each distinct pair gets the next free id.
     */
    static final class StatePairing {
        private final Map<Long, Integer> ids = new HashMap<>();

        int id(int s1, int s2) {
            return ids.computeIfAbsent(key(s1, s2), k -> ids.size());
        }

        boolean contains(int s1, int s2) {
            return ids.containsKey(key(s1, s2));
        }

        private static long key(int s1, int s2) {
            return ((long) s1 << 32) | (s2 & 0xffffffffL);
        }
    }
}
