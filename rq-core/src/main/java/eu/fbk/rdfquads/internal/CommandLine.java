package eu.fbk.rdfquads.internal;

import java.io.File;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;

import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.slf4j.Logger;

import ch.qos.logback.classic.Level;

import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.TermFactory;
import eu.fbk.rdfquads.rio.Syntax;

/**
 * Parsed command line of a tool, built through {@link #parser()} on top of Apache Commons CLI.
 * <p>
 * Options {@code -h/--help} and {@code -v/--version} are always available and, if a logger is
 * supplied, {@code -V/--verbose} raises its level to DEBUG. Displaying help or version, as well
 * as any syntax error, is reported by throwing a {@link CommandLine.Exception}: with a null
 * message in the first case (the tool should terminate successfully), with the error message in
 * the second one.
 * </p>
 */
public final class CommandLine {

    /** Exit status of a successful execution. */
    public static final int EXIT_OK = 0;

    /** Exit status of an execution that failed processing its input. */
    public static final int EXIT_FAILURE = 1;

    /** Exit status of an invocation with invalid arguments. */
    public static final int EXIT_USAGE = 2;

    private final List<String> args;

    private final List<String> options;

    private final Map<String, List<String>> optionValues;

    private CommandLine(final List<String> args, final Map<String, List<String>> optionValues) {

        final List<String> options = Lists.newArrayList();
        for (final String letterOrName : optionValues.keySet()) {
            if (letterOrName.length() > 1) {
                options.add(letterOrName);
            }
        }

        this.args = args;
        this.options = Ordering.natural().immutableSortedCopy(options);
        this.optionValues = optionValues;
    }

    public <T> List<T> getArgs(final Class<T> type) {
        return convert(this.args, type);
    }

    public <T> T getArg(final int index, final Class<T> type) {
        return convert(this.args.get(index), type);
    }

    public int getArgCount() {
        return this.args.size();
    }

    public List<String> getOptions() {
        return this.options;
    }

    public boolean hasOption(final String letterOrName) {
        return this.optionValues.containsKey(letterOrName);
    }

    public <T> List<T> getOptionValues(final String letterOrName, final Class<T> type) {
        final List<String> strings = MoreObjects.firstNonNull(
                this.optionValues.get(letterOrName), ImmutableList.<String>of());
        return convert(strings, type);
    }

    @Nullable
    public <T> T getOptionValue(final String letterOrName, final Class<T> type) {
        final List<String> strings = this.optionValues.get(letterOrName);
        if (strings == null || strings.isEmpty()) {
            return null;
        }
        if (strings.size() > 1) {
            throw new Exception("Multiple values for option '" + letterOrName + "': "
                    + Joiner.on(", ").join(strings));
        }
        return convert(strings.get(0), type);
    }

    @Nullable
    public <T> T getOptionValue(final String letterOrName, final Class<T> type,
            @Nullable final T defaultValue) {
        final T value = getOptionValue(letterOrName, type);
        return value != null ? value : defaultValue;
    }

    private static <T> T convert(final String string, final Class<T> type) {
        try {
            final Object result;
            if (type == String.class) {
                result = string;
            } else if (type == File.class) {
                result = new File(string);
            } else if (type == Integer.class) {
                result = Integer.valueOf(string);
            } else if (type == IRI.class) {
                Preconditions.checkArgument(IRIs.isAbsolute(string));
                result = TermFactory.getDefault().createIRI(string);
            } else if (type == Syntax.class) {
                result = Syntax.valueOfAny(string);
            } else {
                throw new IllegalArgumentException("Unsupported type " + type);
            }
            return type.cast(result);
        } catch (final RuntimeException ex) {
            throw new Exception("'" + string + "' is not a valid " + type.getSimpleName(), ex);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> convert(final List<String> strings, final Class<T> type) {
        if (type == String.class) {
            return (List<T>) strings;
        }
        final List<T> list = Lists.newArrayList();
        for (final String string : strings) {
            list.add(convert(string, type));
        }
        return ImmutableList.copyOf(list);
    }

    /**
     * Reports a failure of a tool on the error stream and returns the matching exit status.
     *
     * @param throwable
     *            the failure
     * @param err
     *            the stream where to report it
     * @return {@link #EXIT_OK} if help or version were displayed, {@link #EXIT_USAGE} on
     *         command line errors, {@link #EXIT_FAILURE} otherwise
     */
    public static int fail(final Throwable throwable, final PrintStream err) {
        if (throwable instanceof Exception) {
            if (throwable.getMessage() == null) {
                return EXIT_OK;
            }
            err.println("SYNTAX ERROR: " + throwable.getMessage());
            return EXIT_USAGE;
        }
        err.println("EXECUTION FAILED: " + throwable.getMessage());
        throwable.printStackTrace(err);
        return EXIT_FAILURE;
    }

    public static Parser parser() {
        return new Parser();
    }

    public static final class Parser {

        @Nullable
        private String name;

        @Nullable
        private String header;

        @Nullable
        private String footer;

        @Nullable
        private Logger logger;

        private PrintStream out;

        private final Options options;

        private final Set<String> mandatoryOptions;

        private final Map<String, Type> optionTypes;

        public Parser() {
            this.name = null;
            this.header = null;
            this.footer = null;
            this.out = System.out;
            this.options = new Options();
            this.mandatoryOptions = new LinkedHashSet<String>();
            this.optionTypes = Maps.newHashMap();
        }

        public Parser withName(@Nullable final String name) {
            this.name = name;
            return this;
        }

        public Parser withHeader(@Nullable final String header) {
            this.header = header;
            return this;
        }

        public Parser withFooter(@Nullable final String footer) {
            this.footer = footer;
            return this;
        }

        public Parser withLogger(@Nullable final Logger logger) {
            this.logger = logger;
            return this;
        }

        public Parser withOutput(final PrintStream out) {
            this.out = Preconditions.checkNotNull(out);
            return this;
        }

        public Parser withOption(@Nullable final String letter, final String name,
                final String description) {

            Preconditions.checkNotNull(name);
            Preconditions.checkArgument(name.length() > 1);
            Preconditions.checkNotNull(description);

            this.options.addOption(new Option(letter, name, false, description));
            return this;
        }

        public Parser withOption(@Nullable final String letter, final String name,
                final String description, final String argName, final Type argType,
                final boolean multiValue, final boolean mandatory) {

            Preconditions.checkNotNull(name);
            Preconditions.checkArgument(name.length() > 1);
            Preconditions.checkNotNull(description);
            Preconditions.checkNotNull(argName);
            Preconditions.checkNotNull(argType);

            final Option option = new Option(letter, name, true, description);
            option.setArgName(argName);
            option.setArgs(multiValue ? Option.UNLIMITED_VALUES : 1);
            this.options.addOption(option);
            this.optionTypes.put(name, argType);

            if (mandatory) {
                this.mandatoryOptions.add(name);
            }

            return this;
        }

        public CommandLine parse(final String... args) {

            // Add standard options
            if (this.logger != null && !this.options.hasOption("V")) {
                this.options.addOption("V", "verbose", false, "enable verbose output");
            }
            if (!this.options.hasOption("v")) {
                this.options.addOption("v", "version", false,
                        "display version information and terminate");
                this.options.addOption("h", "help", false,
                        "display this help message and terminate");
            }

            // Parse options
            final org.apache.commons.cli.CommandLine cmd;
            try {
                cmd = new DefaultParser().parse(this.options, args);
            } catch (final org.apache.commons.cli.ParseException ex) {
                throw new Exception(ex.getMessage() + "\n" + usage(), ex);
            }

            // Handle verbose mode
            if (cmd.hasOption('V') && this.logger instanceof ch.qos.logback.classic.Logger) {
                ((ch.qos.logback.classic.Logger) this.logger).setLevel(Level.DEBUG);
            }

            // Handle version and help commands. Throw an exception to halt execution
            if (cmd.hasOption('v')) {
                printVersion();
                throw new Exception(null);
            } else if (cmd.hasOption('h')) {
                printHelp();
                throw new Exception(null);
            }

            // Check that mandatory options have been specified
            for (final String name : this.mandatoryOptions) {
                if (!cmd.hasOption(name)) {
                    throw new Exception("missing mandatory option " + name + "\n" + usage());
                }
            }

            // Extract options and their arguments, validating them
            final Map<String, List<String>> optionValues = Maps.newHashMap();
            for (final Option option : cmd.getOptions()) {
                final List<String> valueList = Lists.newArrayList();
                final String[] values = option.getValues();
                final Type type = this.optionTypes.get(option.getLongOpt());
                if (values != null) {
                    for (final String value : values) {
                        if (type != null && !type.validate(value)) {
                            throw new Exception("'" + value + "' is not a valid "
                                    + option.getArgName() + " for option " + option.getLongOpt());
                        }
                        valueList.add(value);
                    }
                }
                final List<String> valueSet = ImmutableList.copyOf(valueList);
                final List<String> previous = optionValues.get(option.getLongOpt());
                final List<String> merged = previous == null ? valueSet : ImmutableList
                        .<String>builder().addAll(previous).addAll(valueSet).build();
                optionValues.put(option.getLongOpt(), merged);
                if (option.getOpt() != null) {
                    optionValues.put(option.getOpt(), merged);
                }
            }

            return new CommandLine(ImmutableList.copyOf(cmd.getArgList()), optionValues);
        }

        private String usage() {
            final StringWriter string = new StringWriter();
            final PrintWriter out = new PrintWriter(string);
            new HelpFormatter().printUsage(out, 80, MoreObjects.firstNonNull(this.name, "java"),
                    this.options);
            out.flush();
            return string.toString().trim();
        }

        private void printVersion() {
            final String version = Util.getVersion("eu.fbk.rdfquads", "rq-tool",
                    "(development)");
            final String name = MoreObjects.firstNonNull(this.name, "Version");
            this.out.println(String.format("%s %s\nJava %s (%s)", name, version,
                    System.getProperty("java.version"), System.getProperty("java.vendor")));
            this.out.flush();
        }

        private void printHelp() {
            final HelpFormatter formatter = new HelpFormatter();
            final PrintWriter out = new PrintWriter(this.out);
            final String name = MoreObjects.firstNonNull(this.name, "java");
            formatter.printUsage(out, 80, name, this.options);
            if (this.header != null) {
                out.println();
                formatter.printWrapped(out, 80, this.header);
            }
            out.println();
            formatter.printOptions(out, 80, this.options, 2, 2);
            if (this.footer != null) {
                out.println();
                out.println(this.footer);
            }
            out.flush();
        }

    }

    public static final class Exception extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public Exception(@Nullable final String message) {
            super(message);
        }

        public Exception(@Nullable final String message, final Throwable cause) {
            super(message, cause);
        }

    }

    /** Types of option arguments, validated when the command line is parsed. */
    public enum Type {

        STRING,

        IRI,

        SYNTAX,

        FILE,

        FILE_EXISTING;

        public boolean validate(final String string) {
            switch (this) {
            case IRI:
                return IRIs.isAbsolute(string);
            case SYNTAX:
                try {
                    Syntax.valueOfAny(string);
                    return true;
                } catch (final IllegalArgumentException ex) {
                    return false;
                }
            case FILE:
                final File file = new File(string);
                return !file.exists() || file.isFile();
            case FILE_EXISTING:
                return new File(string).isFile();
            default:
                return true;
            }
        }

    }

}
