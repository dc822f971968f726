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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * <p>
 * Builds a map from a command line so options can be looked up by name. Given:
 * </p>
 *
 * <pre>
 * java SinogramDemo image.png -out sino.png -step 0.5 -nopad
 * </pre>
 *
 * <p>
 * the parser yields {@code out -> "sino.png"}, {@code step -> "0.5"} and
 * {@code nopad -> "true"}, while {@code image.png} ends up in
 * {@link #getNonOptionArgs()}.
 * </p>
 *
 * <p>
 * An argument that starts with a '-' is an option name unless it parses as a
 * number, in which case it's the value of the preceding option. That lets
 * {@code -fill -1.0} or {@code -start -90} work as expected. An option with no value
 * takes the next argument if there is one, so {@code -nopad image.png} sets
 * {@code nopad -> "image.png"}. Put non-option arguments before the flags.
 * </p>
 */
public class CommandLineParser extends HashMap<String, String> {
    private static final long serialVersionUID = 1599477341664265366L;

    private int argc;
    private final List<String> noargs = new ArrayList<>();

    /**
     * A null args array results in an empty map.
     */
    public CommandLineParser(final String[] args) {
        parse(args);
    }

    public int getTotalArgCount() {
        return argc;
    }

    public int getOptionCount() {
        return size();
    }

    public List<String> getNonOptionArgs() {
        return noargs;
    }

    public boolean isSet(final String option) {
        return containsKey(option);
    }

    public String getString(final String option, final String defaultValue) {
        final String val = get(option);
        return val == null ? defaultValue : val;
    }

    /**
     * @throws IllegalArgumentException if the option is present but isn't a number.
     */
    public double getDouble(final String option, final double defaultValue) {
        final String val = get(option);
        if(val == null)
            return defaultValue;
        try {
            return Double.parseDouble(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The value for option \"-" + option + "\" should be a number but was \"" + val + "\"", nfe);
        }
    }

    /**
     * @throws IllegalArgumentException if the option is present but isn't an integer.
     */
    public int getInt(final String option, final int defaultValue) {
        final String val = get(option);
        if(val == null)
            return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The value for option \"-" + option + "\" should be an integer but was \"" + val + "\"", nfe);
        }
    }

    private void parse(final String[] args) {
        if(args == null)
            return;

        argc = args.length;

        for(int i = 0; i < argc; i++) {
            final String cur = args[i].trim();
            if(cur.isEmpty())
                continue;

            if(isOptionName(cur)) {
                final String name = cur.substring(1);
                String val = null;
                if(i + 1 < argc && !isOptionName(args[i + 1].trim())) {
                    val = args[i + 1].trim();
                    i++;
                }
                put(name, val == null ? "true" : val);
            } else
                noargs.add(cur);
        }
    }

    private static boolean isOptionName(final String arg) {
        if(arg.length() < 2 || arg.charAt(0) != '-')
            return false;
        try {
            Double.parseDouble(arg);
            return false; // negative number
        } catch(final NumberFormatException nfe) {
            return true;
        }
    }
}
