package io.synthtools.matcher.inventory;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.fail;

public class AttributePathTest {

    @Test
    public void WHEN_PathHasDots_THEN_ItIsSplitIntoSteps() {
        AttributePath path = AttributePath.of("site.site_name");
        assertEquals(Arrays.asList("site", "site_name"), path.steps());
        assertEquals("site.site_name", path.name());
        assertEquals("site.site_name", path.toString());
    }

    @Test
    public void WHEN_PathHasNoDots_THEN_ItHasOneStep() {
        assertEquals(Collections.singletonList("device_type"), AttributePath.of("device_type").steps());
    }

    @Test
    public void testEquality() {
        assertEquals(AttributePath.of("a.b"), AttributePath.of("a.b"));
        assertEquals(AttributePath.of("a.b").hashCode(), AttributePath.of("a.b").hashCode());
        assertNotEquals(AttributePath.of("a.b"), AttributePath.of("a"));
    }

    @Test
    public void testEmptyStepsRejected() {
        String[] bads = { "", ".", "a.", ".a", "a..b" };
        for (String bad : bads) {
            try {
                AttributePath.of(bad);
                fail("Allowed bad path: '" + bad + "'");
            } catch (IllegalArgumentException e) {
                //yay
            }
        }
    }
}
