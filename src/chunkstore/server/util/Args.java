package chunkstore.server.util;

import chunkstore.server.*;
import chunkstore.shared.util.*;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class Args {
    private static final String CONFIG_FILENAME = "config";

    private final List<String> commands;
    private final Map<String, String> params;//insertion order

    public Args(List<String> commands, Map<String, String> params) {
        this.commands = commands;
        this.params = params;
    }

    public List<String> commands() {
        return new ArrayList<>(commands);
    }

    public String getArg(String param, String def) {
        if (!params.containsKey(param))
            return def;
        return params.get(param);
    }

    public String getArg(String param) {
        if (!params.containsKey(param))
            throw new IllegalStateException("No parameter: " + param);
        return params.get(param);
    }

    public Optional<String> getOptionalArg(String param) {
        return Optional.ofNullable(params.get(param));
    }

    public Args setArg(String param, String value) {
        Map<String, String> newParams = paramMap();
        newParams.putAll(params);
        newParams.put(param, value);
        return new Args(commands, newParams);
    }

    public boolean hasArg(String arg) {
        return params.containsKey(arg);
    }

    public boolean getBoolean(String param, boolean def) {
        if (!params.containsKey(param))
            return def;
        return "true".equals(params.get(param));
    }

    public int getInt(String param, int def) {
        if (!params.containsKey(param))
            return def;
        return Integer.parseInt(params.get(param));
    }

    public long getLong(String param, long def) {
        if (!params.containsKey(param))
            return def;
        return Long.parseLong(params.get(param));
    }

    public double getDouble(String param, double def) {
        if (!params.containsKey(param))
            return def;
        return Double.parseDouble(params.get(param));
    }

    public Args tail() {
        return new Args(commands.subList(1, commands.size()), params);
    }

    public Optional<String> head() {
        return commands.stream()
                .findFirst();
    }

    public Args setIfAbsent(String key, String value) {
        if (params.containsKey(key))
            return this;
        return setArg(key, value);
    }

    public Args with(String key, String value) {
        return setArg(key, value);
    }

    public Path fromStoreDir(String fileName) {
        return fromStoreDir(fileName, null);
    }

    /**
     * Get the path to a file-name in the store directory
     *
     * @param fileName
     * @param defaultName
     * @return
     */
    public Path fromStoreDir(String fileName, String defaultName) {
        Path storeDir = getStoreDir();
        String fName = defaultName == null ? getArg(fileName) : getArg(fileName, defaultName);
        return storeDir.resolve(fName);
    }

    public Path getStoreDir() {
        return hasArg(Main.STORE_DIR) ? Paths.get(getArg(Main.STORE_DIR)) : Main.DEFAULT_STORE_DIR_PATH;
    }

    private static Map<String, String> parseEnv() {
        Map<String, String> map = paramMap();
        map.putAll(System.getenv());
        return map;
    }

    private static Map<String, String> parseFile(Map<String, String> args, Map<String, String> env) {
        String dir = args.getOrDefault(Main.STORE_DIR, env.get(Main.STORE_DIR));
        Path toFile = (dir != null ? Paths.get(dir) : Main.DEFAULT_STORE_DIR_PATH).resolve(CONFIG_FILENAME);
        return parseFile(toFile);
    }

    private static Map<String, String> parseFile(Path path) {
        try {
            if (! path.toFile().exists())
                return Collections.emptyMap();
            List<String> lines = Files.readAllLines(path);

            return lines.stream()
                    .filter(line -> !line.isEmpty())
                    .filter(line -> !line.matches("\\s+"))
                    .map(Args::parseLine)
                    .filter(Optional::isPresent)
                    .map(Optional::get)
                    .collect(Collectors.toMap(
                            e -> e.left,
                            e -> e.right));

        } catch (IOException ioe) {
            throw new IllegalStateException(ioe.getMessage(), ioe);
        }
    }

    private static Map<String, String> parseParams(String[] args) {
        Map<String, String> map = paramMap();
        for (int i = 0; i < args.length; i++) {
            String argName = args[i];
            if (! argName.startsWith("-"))
                continue;
            argName = argName.substring(1);

            if ((i == args.length - 1) || args[i + 1].startsWith("-"))
                map.put(argName, "true");
            else
                map.put(argName, args[++i]);
        }
        return map;
    }

    private static List<String> parseCommands(String[] args) {
        List<String> commands = new ArrayList<>();
        for (String arg: args)
            if (! arg.startsWith("-"))
                commands.add(arg);
            else break;
        return commands;
    }

    /**
     * params overrides configFile overrides env
     *
     * @param params
     * @param configFile
     * @param includeEnv
     * @return
     */
    public static Args parse(String[] params, Optional<Path> configFile, boolean includeEnv) {
        List<String> commands = parseCommands(params);
        Map<String, String> fromEnv = includeEnv ? parseEnv() : Collections.emptyMap();
        Map<String, String> fromParams = parseParams(params);
        Map<String, String> fromFile = configFile.isPresent() ?
                parseFile(configFile.get()) :
                parseFile(fromParams, fromEnv);

        Map<String, String> combined = paramMap();

        Stream.of(
                fromParams.entrySet(),
                fromFile.entrySet(),
                fromEnv.entrySet()
        )
                .flatMap(e -> e.stream())
                .forEach(e -> combined.putIfAbsent(e.getKey(), e.getValue()));

        return new Args(commands, combined);
    }

    public static Args parse(String[] args) {
        return parse(args, Optional.empty(), true);
    }

    /**
     * Parses a line of the form "key = value # comment", omitting full line comments
     *
     * @param originalLine
     * @return
     */
    private static Optional<Pair<String, String>> parseLine(String originalLine) {
        String line = originalLine.trim();

        int commentPos = line.indexOf("#");
        // This line is a pure comment
        if (commentPos == 0)
            return Optional.empty();

        // Enforce a space before # for a comment not at start of line
        if (commentPos != -1 && line.charAt(commentPos - 1) == ' ')
            line = line.substring(0, commentPos).trim();

        String[] split = line.split("=");
        if (split.length != 2)
            throw new IllegalStateException("Illegal line '" + line + "'");

        return Optional.of(new Pair<>(split[0].trim(), split[1].trim()));
    }

    private static <K, V> Map<K, V> paramMap() {
        return new LinkedHashMap<>(16, 0.75f, false);
    }
}
