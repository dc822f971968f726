/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.radon4j.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class TestCommandLineParser {

    @Test
    public void testOptionsAndValues() {
        final CommandLineParser clp = new CommandLineParser(new String[] {"image.png","-out","sino.png","-step","0.5","-nopad"});

        assertEquals(6, clp.getTotalArgCount());
        assertEquals(3, clp.getOptionCount());
        assertEquals("sino.png", clp.getString("out", null));
        assertEquals(0.5, clp.getDouble("step", 1.0), 0.0);
        assertTrue(clp.isSet("nopad"));
        assertEquals("true", clp.get("nopad"));
        assertEquals(Arrays.asList("image.png"), clp.getNonOptionArgs());
    }

    @Test
    public void testNegativeNumbersAreValues() {
        final CommandLineParser clp = new CommandLineParser(new String[] {"-fill","-1.5","-start","-90","-nofov"});

        assertEquals(-1.5, clp.getDouble("fill", 0.0), 0.0);
        assertEquals(-90, clp.getInt("start", 0));
        assertTrue(clp.isSet("nofov"));
        assertEquals(3, clp.getOptionCount());
    }

    @Test
    public void testDefaults() {
        final CommandLineParser clp = new CommandLineParser(null);

        assertEquals(0, clp.getTotalArgCount());
        assertFalse(clp.isSet("threads"));
        assertEquals(4, clp.getInt("threads", 4));
        assertEquals("x", clp.getString("in", "x"));
        assertTrue(clp.getNonOptionArgs().isEmpty());
    }

    @Test
    public void testBadNumber() {
        final CommandLineParser clp = new CommandLineParser(new String[] {"-threads","many"});

        final IllegalArgumentException iae = assertThrows(IllegalArgumentException.class, () -> clp.getInt("threads", 1));
        assertTrue(iae.getMessage().contains("-threads"));
    }
}
