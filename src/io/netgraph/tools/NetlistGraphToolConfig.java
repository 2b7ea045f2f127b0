/*
 * Copyright (c) 2026, NetGraph contributors.
 * All rights reserved.
 *
 * This file is part of NetGraph.
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

package io.netgraph.tools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.netgraph.util.MessageGenerator;
import io.netgraph.util.Params;
import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * The parameters of a {@link NetlistGraphTool} run. Values can be provided as
 * command-line arguments or through the setters; switches not given on the
 * command line fall back to the global {@link Params}.
 */
public class NetlistGraphToolConfig {

    private String inputFileName;

    private String outputFileName;

    private String moduleName;

    private boolean printHierarchy;

    private boolean strict;

    private boolean verbose;

    private int maxNestedDepth;

    private boolean help;

    private static final List<String> INPUT_OPTS = Arrays.asList("i", "input");
    private static final List<String> OUTPUT_OPTS = Arrays.asList("o", "output");
    private static final List<String> MODULE_OPTS = Arrays.asList("m", "module");
    private static final List<String> HIERARCHY_OPTS = Collections.singletonList("hierarchy");
    private static final List<String> STRICT_OPTS = Collections.singletonList("strict");
    private static final List<String> VERBOSE_OPTS = Arrays.asList("v", "verbose");
    private static final List<String> MAX_NESTED_DEPTH_OPTS = Collections.singletonList("max-nested-depth");
    private static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    public NetlistGraphToolConfig() {
        strict = Params.NETGRAPH_STRICT;
        verbose = Params.NETGRAPH_VERBOSE;
        maxNestedDepth = Params.NETGRAPH_MAX_NESTED_DEPTH;
    }

    public NetlistGraphToolConfig(String inputFileName) {
        this();
        setInputFileName(inputFileName);
    }

    public NetlistGraphToolConfig(String[] arguments) {
        this();
        parseArguments(arguments);
    }

    public static OptionParser createOptionParser() {
        return new OptionParser() {
            {
                acceptsAll(INPUT_OPTS, "Input Yosys JSON netlist (*.json or *.json.gz)").withRequiredArg();
                acceptsAll(OUTPUT_OPTS, "Output JSON graph report").withRequiredArg();
                acceptsAll(MODULE_OPTS, "Restrict the report to the named module").withRequiredArg();
                acceptsAll(HIERARCHY_OPTS, "Print the sub-module hierarchy below the top module");
                acceptsAll(STRICT_OPTS, "Stop at the first rejected module");
                acceptsAll(VERBOSE_OPTS, "Print per-module stage timing and statistics");
                acceptsAll(MAX_NESTED_DEPTH_OPTS, "Maximum nested resolution depth (default "
                        + Params.NETGRAPH_DEFAULT_MAX_NESTED_DEPTH + ")").withRequiredArg();
                acceptsAll(HELP_OPTS, "Print this help message").forHelp();
            }
        };
    }

    public static void printHelp() {
        OptionParser p = createOptionParser();
        MessageGenerator.printHeader("NetlistGraphTool");
        System.out.println("Reconstructs the signal graph of a Yosys JSON netlist.");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void parseArguments(String[] arguments) {
        OptionParser p = createOptionParser();
        OptionSet options = p.parse(arguments);

        if (options.has(HELP_OPTS.get(0))) {
            setHelp(true);
            return;
        }

        if (options.has(INPUT_OPTS.get(0))) {
            setInputFileName((String) options.valueOf(INPUT_OPTS.get(0)));
        } else {
            throw new RuntimeException("ERROR: No input netlist found. "
                    + "Please specify an input Yosys JSON file using options " + INPUT_OPTS);
        }
        if (options.has(OUTPUT_OPTS.get(0))) {
            setOutputFileName((String) options.valueOf(OUTPUT_OPTS.get(0)));
        }
        if (options.has(MODULE_OPTS.get(0))) {
            setModuleName((String) options.valueOf(MODULE_OPTS.get(0)));
        }
        setPrintHierarchy(options.has(HIERARCHY_OPTS.get(0)));
        if (options.has(STRICT_OPTS.get(0))) {
            setStrict(true);
        }
        if (options.has(VERBOSE_OPTS.get(0))) {
            setVerbose(true);
        }
        if (options.has(MAX_NESTED_DEPTH_OPTS.get(0))) {
            String value = (String) options.valueOf(MAX_NESTED_DEPTH_OPTS.get(0));
            try {
                setMaxNestedDepth(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new RuntimeException("ERROR: Invalid maximum nested depth: " + value, e);
            }
        }
    }

    public String getInputFileName() {
        return inputFileName;
    }

    public void setInputFileName(String inputFileName) {
        this.inputFileName = inputFileName;
    }

    public String getOutputFileName() {
        return outputFileName;
    }

    public void setOutputFileName(String outputFileName) {
        this.outputFileName = outputFileName;
    }

    public String getModuleName() {
        return moduleName;
    }

    public void setModuleName(String moduleName) {
        this.moduleName = moduleName;
    }

    public boolean isPrintHierarchy() {
        return printHierarchy;
    }

    public void setPrintHierarchy(boolean printHierarchy) {
        this.printHierarchy = printHierarchy;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public int getMaxNestedDepth() {
        return maxNestedDepth;
    }

    public void setMaxNestedDepth(int maxNestedDepth) {
        if (maxNestedDepth < 0) {
            throw new RuntimeException("ERROR: Maximum nested depth must not be negative: " + maxNestedDepth);
        }
        this.maxNestedDepth = maxNestedDepth;
    }

    public boolean isHelp() {
        return help;
    }

    public void setHelp(boolean help) {
        this.help = help;
    }

    @Override
    public String toString() {
        return "NetlistGraphToolConfig(input=" + inputFileName + ", output=" + outputFileName
                + ", module=" + moduleName + ", hierarchy=" + printHierarchy + ", strict=" + strict
                + ", verbose=" + verbose + ", maxNestedDepth=" + maxNestedDepth + ")";
    }
}
