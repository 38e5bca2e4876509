package chunkstore.server;

import chunkstore.server.util.Args;
import chunkstore.server.util.Logging;

import java.util.*;
import java.util.function.*;
import java.util.stream.Collectors;

/** A named command line entry point with its documented parameters and any sub commands.
 */
public class Command<V> {
    public static class Arg {
        public final String name, description;
        public final boolean isRequired;
        public final Optional<String> defaultValue;

        public Arg(String name, String description, boolean isRequired) {
            this.name = name;
            this.description = description;
            this.isRequired = isRequired;
            this.defaultValue = Optional.empty();
        }

        public Arg(String name, String description, boolean isRequired, String defaultValue) {
            this.name = name;
            this.description = description;
            this.isRequired = isRequired;
            this.defaultValue = Optional.of(defaultValue);
        }
    }

    public final String name, description;
    public final Function<Args, V> entryPoint;
    public final List<Arg> params;
    public final Map<String, Command<?>> subCommands;

    public Command(String name, String description, Function<Args, V> entryPoint, List<Arg> params) {
        this(name, description, entryPoint, params, Collections.emptyList());
    }

    public Command(String name,
                   String description,
                   Function<Args, V> entryPoint,
                   List<Arg> params,
                   List<Command<?>> subCommands) {
        this.name = name;
        this.description = description;
        this.entryPoint = entryPoint;
        this.params = params;
        this.subCommands = subCommands.stream()
                .collect(Collectors.toMap(c -> c.name, c -> c, (a, b) -> b, LinkedHashMap::new));
    }

    /** Run this command, or the sub command named by the first positional argument.
     *
     * @param args
     * @return the result of the entry point, or null if a sub command or the help text was run instead
     */
    public V main(Args args) {
        for (Arg param : params) {
            if (param.defaultValue.isPresent())
                args = args.setIfAbsent(param.name, param.defaultValue.get());
        }
        Optional<String> head = args.head();
        if (head.isPresent() && subCommands.containsKey(head.get())) {
            subCommands.get(head.get()).main(args.tail());
            return null;
        }

        if (args.hasArg("help")) {
            System.out.println(helpMessage());
            return null;
        }

        ensureArgs(args);
        Logging.init(args);
        return entryPoint.apply(args);
    }

    private void ensureArgs(Args args) {
        Optional<String> missing = params.stream()
                .filter(p -> p.isRequired)
                .map(p -> p.name)
                .filter(p -> ! args.hasArg(p))
                .findFirst();
        if (missing.isPresent())
            throw new IllegalStateException(name + " requires argument " + missing.get());
    }

    public String helpMessage() {
        String nl = System.lineSeparator();
        return name + ": " + description + nl
                + (params.isEmpty() ? "" : "Parameters: " + nl)
                + params.stream()
                        .map(p -> "\t" + p.name + ": " + p.description + p.defaultValue.map(d -> " (default " + d + ")").orElse(""))
                        .collect(Collectors.joining(nl))
                + (subCommands.isEmpty() ? "" : nl + "Sub commands:" + nl)
                + subCommands.values().stream()
                        .map(c -> "\t" + c.name + ": " + c.description)
                        .collect(Collectors.joining(nl));
    }
}
