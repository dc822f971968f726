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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A simple utility for consistently determining whether or not to pop up
 * windows with intermediate results. The system property {@code radon4j.SHOW}
 * wins over the environment variable {@code RADON4J_SHOW}. Setting the property
 * with no value (-Dradon4j.SHOW) counts as {@code true}.
 */
public class DetermineShowFlag {
    private static final Logger LOGGER = LoggerFactory.getLogger(DetermineShowFlag.class);

    public static final String SHOW_PROPERTY = "radon4j.SHOW";
    public static final String SHOW_ENV = "RADON4J_SHOW";

    public final static boolean SHOW; /// can only be true on a machine with a display

    static {
        SHOW = determine(System.getProperty(SHOW_PROPERTY), System.getenv(SHOW_ENV));
        LOGGER.debug("Showing intermediate results: {}", SHOW);
    }

    static boolean determine(final String sysOpSHOW, final String envSHOW) {
        if(sysOpSHOW != null)
            return "".equals(sysOpSHOW) || Boolean.parseBoolean(sysOpSHOW);
        return Boolean.parseBoolean(envSHOW);
    }
}
