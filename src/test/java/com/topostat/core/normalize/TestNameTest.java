package com.topostat.core.normalize;

import com.topostat.core.error.Attempt;
import com.topostat.core.error.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TestNameTest {

    @Test
    @DisplayName("splits a three-segment name and trims each segment")
    void parsesThreeSegments() {
        TestName name = TestName.parse(" bgpd . test_basic .test_convergence").value();
        assertEquals(new TestName("bgpd", "test_basic", "test_convergence"), name);
    }

    @Test
    @DisplayName("anything but exactly three non-empty segments is a normalization failure")
    void rejectsOtherShapes() {
        for (String input : new String[] {"a.b", "a.b.c.d", "a..c", "a.b.", ".b.c", "a. .c", "abc"}) {
            Attempt<TestName> parsed = TestName.parse(input);
            assertEquals(ErrorKind.NORMALIZATION, parsed.error(), input);
        }
        assertEquals(ErrorKind.NORMALIZATION, TestName.parse(null).error());
    }
}
