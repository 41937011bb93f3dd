package co.fanki.citationtree.fragment.domain;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for {@link ViewportFilterParser}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ViewportFilterParserTest {

    @Test
    void whenParsing_givenCommaSeparatedIds_shouldReturnThem() {
        assertEquals(Set.of(1, 4, 7),
                ViewportFilterParser.parseClusters(" 1, 4 ,7,"));
    }

    @Test
    void whenParsing_givenBlank_shouldReturnNull() {
        assertNull(ViewportFilterParser.parseClusters("  "));
        assertNull(ViewportFilterParser.parseClusters(null));
    }

    @Test
    void whenParsing_givenMalformedToken_shouldIgnoreTheFilter() {
        assertNull(ViewportFilterParser.parseClusters("1,two,3"));
    }

}
