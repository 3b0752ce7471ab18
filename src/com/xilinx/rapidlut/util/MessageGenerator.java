/*
 * Copyright (c) 2024, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidLUT.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.rapidlut.util;

/**
 * Common class for generating console messages from the mapping passes.
 */
public class MessageGenerator {

    /** Width of the label column used by {@link #formatString(String, Object)} */
    public static final int LABEL_WIDTH = 40;

    /**
     * Used as a general way to create an error message and send it to
     * std.err.
     * @param msg The message to print to standard error
     */
    public static void briefError(String msg) {
        System.err.println(msg);
    }

    /**
     * Used as a general way to create a message and send it to
     * std.out.
     * @param msg The message to print to standard out
     */
    public static void briefMessage(String msg) {
        System.out.println(msg);
    }

    /**
     * Prints a generic header to standard out to separate operations.
     * @param s The header text.
     */
    public static void printHeader(String s) {
        String bar = "==============================================================================";
        double whiteSpace = (72 - s.length()) / 2.0;
        String left = makeWhiteSpace((int) (whiteSpace));
        String right = makeWhiteSpace((int) (whiteSpace + 0.5));
        System.out.println(bar);
        System.out.println("== " + left + s + right + " ==");
        System.out.println(bar);
    }

    /**
     * Creates a whitespace string with length number of spaces.
     * @param length Number of spaces in the string.
     * @return The newly created whitespace string.
     */
    public static String makeWhiteSpace(int length) {
        if (length < 1)
            return "";
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(" ");
        }
        return sb.toString();
    }

    /**
     * Formats a single line of a report.
     * @param s The line text.
     * @return The line terminated by a newline.
     */
    public static String formatString(String s) {
        return s.endsWith("\n") ? s : s + "\n";
    }

    /**
     * Formats a label/value line of a report, padding the label to a fixed column width.
     * @param label The label, printed left aligned.
     * @param value The value, printed after the label column.
     * @return The formatted line terminated by a newline.
     */
    public static String formatString(String label, Object value) {
        return label + makeWhiteSpace(LABEL_WIDTH - label.length()) + value + "\n";
    }
}
