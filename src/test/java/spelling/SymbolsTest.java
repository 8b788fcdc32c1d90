package spelling;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SymbolsTest {

    @Test
    void splitsByCodePoint() {
        assertThat(Symbols.split("ab")).containsExactly("a", "b");
        assertThat(Symbols.split("a😀b")).containsExactly("a", "😀", "b");
        assertThat(Symbols.split("")).isEmpty();
    }

    @Test
    void epsilon() {
        assertTrue(Symbols.isEpsilon(Symbols.EPSILON));
        assertEquals("ε", Symbols.display(Symbols.EPSILON));
        assertEquals("a", Symbols.display("a"));
    }
}
