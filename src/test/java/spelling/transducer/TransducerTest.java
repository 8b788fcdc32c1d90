package spelling.transducer;

import org.junit.jupiter.api.Test;
import spelling.Symbols;
import spelling.automaton.Automaton;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TransducerTest {

    // 0 -a-> 1 -b-> 2, reading and writing the same symbols.
    private static Transducer identityAb() {
        Transducer m1 = new Transducer();
        m1.addTransition(0, "a", 1);
        m1.addTransition(1, "b", 2);
        m1.markAccepting(2);
        return m1;
    }

    // One accepting state rewriting a as x, b as y, and emitting a stray z without reading anything.
    private static Transducer rewriter() {
        Transducer m2 = new Transducer();
        m2.setStartState(0);
        m2.markAccepting(0);
        m2.addTransition(0, "a", 0, "x", 1.0);
        m2.addTransition(0, "b", 0, "y", 2.0);
        m2.addTransition(0, Symbols.EPSILON, 0, "z", 3.0);
        return m2;
    }

    @Test
    void fromAutomatonIsAnIdentity() {
        Automaton automaton = new Automaton();
        automaton.buildTrie(List.of("ab", "b"));
        Transducer transducer = Transducer.fromAutomaton(automaton);
        assertEquals(automaton.startState(), transducer.startState());
        assertEquals(automaton.states(), transducer.states());
        assertEquals(automaton.acceptingStates(), transducer.acceptingStates());
        assertEquals(automaton.numTransitions(), transducer.numArcs());
        for (int state : automaton.states()) {
            automaton.transitions(state).forEach((symbol, targets) -> {
                Set<Arc> arcs = transducer.arcs(state, symbol);
                assertEquals(targets.size(), arcs.size());
                for (Arc arc : arcs) {
                    assertEquals(symbol, arc.output());
                    assertEquals(0.0, arc.weight());
                    assertTrue(targets.contains(arc.target()));
                }
            });
        }
    }

    @Test
    void nullOutputCopiesInput() {
        Transducer transducer = new Transducer();
        transducer.addTransition(0, "a", 1, null, 0.5);
        assertThat(transducer.arcs(0, "a")).containsExactly(new Arc("a", 1, 0.5));
        int fresh = transducer.addTransition(1, "b");
        assertEquals(2, fresh);
        assertThat(transducer.arcs(1, "b")).containsExactly(new Arc("b", 2, 0.0));
        assertThat(transducer.arcs(1, "c")).isEmpty();
        assertThat(transducer.arcs(9, "a")).isEmpty();
    }

    @Test
    void invertSwapsLabelsAndKeepsTheOriginal() {
        Transducer m2 = rewriter();
        Transducer inverted = m2.invert();
        assertThat(inverted.arcs(0, "x")).containsExactly(new Arc("a", 0, 1.0));
        assertThat(inverted.arcs(0, "z")).containsExactly(new Arc(Symbols.EPSILON, 0, 3.0));
        assertThat(inverted.arcs(0, Symbols.EPSILON)).isEmpty();
        assertEquals(m2.startState(), inverted.startState());
        assertEquals(m2.acceptingStates(), inverted.acceptingStates());
        assertEquals(m2.numArcs(), inverted.numArcs());

        assertThat(m2.arcs(0, "a")).containsExactly(new Arc("x", 0, 1.0));
        assertThat(m2.arcs(0, "x")).isEmpty();
    }

    @Test
    void doubleInversionRestoresArcs() {
        Transducer m2 = rewriter();
        Transducer twice = m2.invert().invert();
        for (String input : List.of("a", "b", Symbols.EPSILON)) {
            assertEquals(m2.arcs(0, input), twice.arcs(0, input));
        }
    }

    @Test
    void composition() {
        Transducer m1 = identityAb();
        Transducer m2 = rewriter();
        int m1Arcs = m1.numArcs();
        Transducer composed = Transducer.compose(m1, m2);

        assertEquals(3, composed.states().size());
        assertEquals(5, composed.numArcs());
        assertEquals(0, composed.startState());
        assertEquals(1, composed.acceptingStates().size());
        assertEquals(m1Arcs, m1.numArcs());

        List<Transduction> results = composed.invert().transduce("xzy").collect(Collectors.toList());
        assertThat(results).containsExactly(new Transduction("ab", 6.0));
        assertEquals(Math.exp(-6.0), results.get(0).score(), 1e-12);
    }

    @Test
    void composedPairsNeverCollide() {
        Transducer m1 = new Transducer();
        m1.addTransition(1, "a", 12);
        m1.markAccepting(12);
        Transducer m2 = new Transducer();
        m2.addTransition(23, "a", 3);
        m2.markAccepting(3);

        Transducer composed = Transducer.compose(m1, m2);
        assertEquals(2, composed.states().size());
        int start = composed.startState();
        assertFalse(composed.isAccepting(start));
        Arc arc = composed.arcs(start, "a").iterator().next();
        assertNotEquals(start, arc.target());
        assertTrue(composed.isAccepting(arc.target()));
    }

    @Test
    void compositionBuildsOnlyReachablePairs() {
        Transducer m1 = new Transducer();
        m1.addTransition(0, "a", 1);
        m1.markAccepting(1);
        Transducer m2 = new Transducer();
        m2.addTransition(0, "a", 1, "x", 0.5);
        m2.markAccepting(1);
        // An island that the start state of m2 never reaches.
        m2.addTransition(5, "a", 6, "y", 0.5);
        m2.markAccepting(6);

        Transducer composed = Transducer.compose(m1, m2);
        assertEquals(2, composed.states().size());
        assertEquals(1, composed.numArcs());
        int start = composed.startState();
        assertThat(composed.arcs(start, "a")).hasSize(1);
        int end = composed.arcs(start, "a").iterator().next().target();
        assertThat(composed.states()).containsExactlyInAnyOrder(start, end);
        assertThat(composed.acceptingStates()).containsExactly(end);
        assertThat(composed.transduce("a").collect(Collectors.toList())).containsExactly(new Transduction("x", 0.5));
    }

    @Test
    void statePairingIsInjective() {
        Transducer.StatePairing pairing = new Transducer.StatePairing();
        assertNotEquals(pairing.id(1, 23), pairing.id(12, 3));
        assertEquals(pairing.id(1, 23), pairing.id(1, 23));
        assertNotEquals(pairing.id(0, 1), pairing.id(1, 0));
        assertNotEquals(pairing.id(-1, 0), pairing.id(0, -1));
    }

    @Test
    void acceptingRequiresBothHalves() {
        Transducer m1 = identityAb();
        Transducer m2 = new Transducer();
        m2.addTransition(0, "a", 1, "a", 0.0);
        m2.addTransition(1, "b", 2, "b", 0.0);
        Transducer composed = Transducer.compose(m1, m2);
        assertThat(composed.acceptingStates()).isEmpty();
        assertThat(composed.invert().transduce("ab").collect(Collectors.toList())).isEmpty();
    }

    @Test
    void resultsComeOutLightestFirst() {
        Transducer transducer = new Transducer();
        transducer.setStartState(0);
        transducer.addTransition(0, "a", 1, "x", 3.0);
        transducer.addTransition(0, "a", 1, "y", 1.0);
        transducer.addTransition(0, "a", 1, "z", 2.0);
        transducer.addTransition(0, "a", 2, "w", 0.5);
        transducer.markAccepting(1);

        List<Transduction> results = transducer.transduce("a").collect(Collectors.toList());
        assertThat(results).extracting(Transduction::output).containsExactly("y", "z", "x");
        assertThat(results).extracting(Transduction::weight).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void cheapestPathWinsWhenPathsMeet() {
        Transducer transducer = new Transducer();
        transducer.setStartState(0);
        transducer.addTransition(0, "a", 1, "x", 5.0);
        transducer.addTransition(0, "a", 2, "x", 1.0);
        transducer.addTransition(1, "b", 3, "y", 0.0);
        transducer.addTransition(2, "b", 3, "y", 1.0);
        transducer.markAccepting(3);

        List<Transduction> results = transducer.transduce("ab").collect(Collectors.toList());
        assertThat(results).containsExactly(new Transduction("xy", 2.0));
    }

    @Test
    void identicalOutputIsNotReported() {
        Transducer transducer = new Transducer();
        transducer.addTransition(0, "a", 1);
        transducer.addTransition(0, "a", 1, "b", 1.0);
        transducer.markAccepting(1);
        assertThat(transducer.transduce("a").map(Transduction::output)).containsExactly("b");
    }

    @Test
    void epsilonCyclesTerminate() {
        Transducer transducer = new Transducer();
        transducer.addTransition(0, Symbols.EPSILON, 1, Symbols.EPSILON, 0.0);
        transducer.addTransition(1, Symbols.EPSILON, 0, Symbols.EPSILON, 0.0);
        transducer.addTransition(1, "a", 2, "b", 1.0);
        transducer.markAccepting(2);
        assertThat(transducer.transduce("a").collect(Collectors.toList()))
                .containsExactly(new Transduction("b", 1.0));
    }

    @Test
    void unknownInputProducesNothing() {
        Transducer transducer = identityAb();
        assertThat(transducer.transduce("q").collect(Collectors.toList())).isEmpty();
        assertThat(new Transducer().transduce("a").collect(Collectors.toList())).isEmpty();
    }

    @Test
    void transductionIsLazy() {
        // Every prefix of z* is accepted, so the full enumeration never ends.
        Transducer transducer = new Transducer();
        transducer.addTransition(0, "a", 1, "b", 1.0);
        transducer.addTransition(1, Symbols.EPSILON, 1, "z", 1.0);
        transducer.markAccepting(1);
        assertThat(transducer.transduce("a").limit(3).map(Transduction::output).collect(Collectors.toList()))
                .containsExactly("b", "bz", "bzz");
    }
}
