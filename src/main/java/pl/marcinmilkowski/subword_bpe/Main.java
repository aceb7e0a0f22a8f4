package pl.marcinmilkowski.subword_bpe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.subword_bpe.apply.BpeEncoder;
import pl.marcinmilkowski.subword_bpe.apply.SegmentationConfig;
import pl.marcinmilkowski.subword_bpe.apply.SubwordVocabularyBuilder;
import pl.marcinmilkowski.subword_bpe.codes.BpeVersion;
import pl.marcinmilkowski.subword_bpe.codes.MergeTable;
import pl.marcinmilkowski.subword_bpe.codes.MergeTableReader;
import pl.marcinmilkowski.subword_bpe.codes.MergeTableSubset;
import pl.marcinmilkowski.subword_bpe.codes.MergeTableWriter;
import pl.marcinmilkowski.subword_bpe.config.BpeConfigLoader;
import pl.marcinmilkowski.subword_bpe.learn.LearnerOptions;
import pl.marcinmilkowski.subword_bpe.learn.MergeLearner;
import pl.marcinmilkowski.subword_bpe.vocabulary.Vocabulary;
import pl.marcinmilkowski.subword_bpe.vocabulary.VocabularyReader;
import pl.marcinmilkowski.subword_bpe.vocabulary.VocabularyWriter;
import pl.marcinmilkowski.subword_bpe.vocabulary.WordCounter;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Command-line entry point for learning and applying BPE merge tables.
 *
 * Commands:
 *   get-vocab   --input corpus.txt --output vocab.txt
 *   learn       --input corpus.txt --output codes.txt --symbols 10000
 *   learn-joint --input a.txt b.txt --output codes.txt --write-vocabulary va.txt vb.txt
 *   apply       --codes codes.txt --input corpus.txt --output corpus.bpe
 *   subset      --codes codes.txt --input vocab.txt --outcodes subset.txt --bpevocab bpevocab.txt
 *
 * Text goes through stdin/stdout when --input/--output are omitted. Diagnostics go to stderr.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs one command and returns the process exit status.
     */
    public static int run(String[] args) {
        if (args.length == 0) {
            showUsage();
            return 1;
        }

        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "get-vocab":
                    handleGetVocabCommand(args);
                    break;
                case "learn":
                    handleLearnCommand(args);
                    break;
                case "learn-joint":
                    handleLearnJointCommand(args);
                    break;
                case "apply":
                    handleApplyCommand(args);
                    break;
                case "subset":
                    handleSubsetCommand(args);
                    break;
                case "help":
                case "--help":
                case "-h":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
                    return 1;
            }
            return 0;
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
            return 1;
        }
    }

    private static void showUsage() {
        System.err.println("Usage: java -jar subword-bpe.jar <command> [options]");
        System.err.println();
        System.err.println("Commands:");
        System.err.println("  get-vocab [--input <text>] [--output <vocab>]");
        System.err.println("      Count whitespace-separated words, most frequent first");
        System.err.println();
        System.err.println("  learn [--input <text>] [--output <codes>] [options]");
        System.err.println("      Learn a merge table");
        System.err.println("      Options:");
        System.err.println("        --symbols, -s <n>        Number of merges to learn (default: 10000)");
        System.err.println("        --min-frequency <n>      Stop when no pair is this frequent (default: 2)");
        System.err.println("        --min-count, -c <n>      Drop words rarer than this before learning (default: 1)");
        System.err.println("        --dict-input             Input is a vocabulary file (word count per line)");
        System.err.println("        --version01              Write a version 0.1 table (detached end-of-word marker)");
        System.err.println("        --forcecodes, -f <codes> Apply these merges first");
        System.err.println("        --grepforcecodes, -g <re> Only force merges whose both parts match this regex");
        System.err.println("        --write-vocabulary, -w <file>  Also write the subword vocabulary");
        System.err.println("        --separator <str>        Subword separator for --write-vocabulary (default: @@)");
        System.err.println("        --verbose, -v            Log every merge");
        System.err.println("        --config <json>          Read defaults from a JSON file");
        System.err.println();
        System.err.println("  learn-joint --input <text>... --output <codes> [--write-vocabulary <file>...] [options]");
        System.err.println("      Learn one merge table for several texts, one subword vocabulary per text");
        System.err.println();
        System.err.println("  apply --codes <codes> [--input <text>] [--output <text>] [options]");
        System.err.println("      Segment text into subwords");
        System.err.println("      Options:");
        System.err.println("        --separator, -s <str>    Subword separator (default: @@)");
        System.err.println("        --vocabulary <file>      Only emit subwords from this vocabulary");
        System.err.println("        --vocabulary-threshold <n>  Ignore vocabulary entries rarer than this");
        System.err.println("        --glossaries <w>...      Words never split");
        System.err.println("        --rglossaries <re>...    Regexes whose matches are never split");
        System.err.println("        --unkchar <c>, --unktag <tag>  Replace a word equal to <c> by <tag>");
        System.err.println("        --config <json>          Read defaults from a JSON file");
        System.err.println();
        System.err.println("  subset --codes <codes> [--input <vocab>] [--min-count <n>] [--outcodes <codes>] [--bpevocab <vocab>]");
        System.err.println("      Write the subword vocabulary of a word vocabulary and the merges it needs");
        System.err.println();
        System.err.println("Examples:");
        System.err.println("  java -jar subword-bpe.jar learn --input train.txt --output codes.txt -s 32000");
        System.err.println("  java -jar subword-bpe.jar apply --codes codes.txt < test.txt > test.bpe");
    }

    private static void handleGetVocabCommand(String[] args) throws IOException {
        Path input = null;
        Path output = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    input = Paths.get(requireValue(args, ++i));
                    break;
                case "--output":
                case "-o":
                    output = Paths.get(requireValue(args, ++i));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        Vocabulary vocabulary;
        try (BufferedReader reader = openInput(input)) {
            vocabulary = WordCounter.count(reader);
        }
        try (Writer writer = openOutput(output)) {
            VocabularyWriter.write(vocabulary, writer);
        }
    }

    private static void handleLearnCommand(String[] args) throws IOException {
        LearnArguments parsed = parseLearnArguments(args);
        if (parsed.inputs.size() > 1) {
            throw new IllegalArgumentException("learn takes one --input; use learn-joint for several");
        }
        Path input = parsed.inputs.isEmpty() ? null : parsed.inputs.get(0);

        Vocabulary vocabulary;
        try (BufferedReader reader = openInput(input)) {
            vocabulary = parsed.dictInput ? VocabularyReader.read(reader, 1) : WordCounter.count(reader);
        }

        LearnerOptions options = parsed.options();
        MergeTable table = new MergeLearner(options).learn(vocabulary);
        try (Writer writer = openOutput(parsed.output)) {
            MergeTableWriter.write(table, writer);
        }

        if (!parsed.vocabularyOutputs.isEmpty()) {
            if (parsed.vocabularyOutputs.size() > 1) {
                throw new IllegalArgumentException("learn writes one --write-vocabulary file");
            }
            writeSubwordVocabulary(table, parsed.segmentation(), vocabulary,
                parsed.vocabularyOutputs.get(0));
        }
    }

    private static void handleLearnJointCommand(String[] args) throws IOException {
        LearnArguments parsed = parseLearnArguments(args);
        if (parsed.inputs.isEmpty() || parsed.output == null) {
            throw new IllegalArgumentException("--input and --output are required");
        }
        if (!parsed.vocabularyOutputs.isEmpty() && parsed.vocabularyOutputs.size() != parsed.inputs.size()) {
            throw new IllegalArgumentException("Must have the same number of --input and --write-vocabulary files: "
                + parsed.inputs.size() + " vs " + parsed.vocabularyOutputs.size());
        }

        List<Vocabulary> vocabularies = new ArrayList<>();
        Vocabulary joint = new Vocabulary();
        for (Path input : parsed.inputs) {
            Vocabulary vocabulary = parsed.dictInput ? VocabularyReader.read(input) : WordCounter.count(input);
            vocabularies.add(vocabulary);
            joint.addAll(vocabulary);
        }
        logger.info("Joint vocabulary: {} words from {} inputs", joint.size(), parsed.inputs.size());

        LearnerOptions options = parsed.options();
        MergeTable table = new MergeLearner(options).learn(joint);
        MergeTableWriter.write(table, parsed.output);

        for (int i = 0; i < parsed.vocabularyOutputs.size(); i++) {
            writeSubwordVocabulary(table, parsed.segmentation(), vocabularies.get(i),
                parsed.vocabularyOutputs.get(i));
        }
    }

    private static void writeSubwordVocabulary(MergeTable table, SegmentationConfig config,
                                               Vocabulary words, Path output) throws IOException {
        BpeEncoder encoder = new BpeEncoder(table, config);
        Vocabulary subwords = SubwordVocabularyBuilder.build(encoder, words);
        VocabularyWriter.write(subwords, output);
    }

    private static LearnArguments parseLearnArguments(String[] args) throws IOException {
        LearnArguments parsed = new LearnArguments();
        Path config = findConfig(args);
        if (config != null) {
            BpeConfigLoader loader = new BpeConfigLoader(config);
            parsed.learn = loader.getLearnerOptions().toBuilder();
            parsed.apply = loader.getSegmentationConfig().toBuilder();
        }

        String forceCodes = null;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    i = collectValues(args, i, parsed.inputs);
                    break;
                case "--output":
                case "-o":
                    parsed.output = Paths.get(requireValue(args, ++i));
                    break;
                case "--symbols":
                case "-s":
                    parsed.learn.symbols(Integer.parseInt(requireValue(args, ++i)));
                    break;
                case "--min-frequency":
                    parsed.learn.minFrequency(Long.parseLong(requireValue(args, ++i)));
                    break;
                case "--min-count":
                case "-c":
                    parsed.learn.minCount(Long.parseLong(requireValue(args, ++i)));
                    break;
                case "--dict-input":
                    parsed.dictInput = true;
                    break;
                case "--version01":
                    parsed.learn.version(BpeVersion.V0_1);
                    break;
                case "--forcecodes":
                case "-f":
                    forceCodes = requireValue(args, ++i);
                    break;
                case "--grepforcecodes":
                case "-g":
                    parsed.learn.forcedMergeFilter(requireValue(args, ++i));
                    break;
                case "--write-vocabulary":
                case "-w":
                    i = collectValues(args, i, parsed.vocabularyOutputs);
                    break;
                case "--separator":
                    parsed.apply.separator(requireValue(args, ++i));
                    break;
                case "--verbose":
                case "-v":
                    parsed.learn.verbose(true);
                    break;
                case "--config":
                    i++;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (forceCodes != null) {
            MergeTable forced = MergeTableReader.read(Paths.get(forceCodes));
            parsed.learn.forcedMerges(forced.merges());
        }
        return parsed;
    }

    private static void handleApplyCommand(String[] args) throws IOException {
        Path codes = null;
        Path input = null;
        Path output = null;
        Path vocabularyPath = null;
        Long vocabularyThreshold = null;

        SegmentationConfig.Builder config = SegmentationConfig.builder();
        Path configPath = findConfig(args);
        if (configPath != null) {
            config = new BpeConfigLoader(configPath).getSegmentationConfig().toBuilder();
        }

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--codes":
                case "-c":
                    codes = Paths.get(requireValue(args, ++i));
                    break;
                case "--input":
                case "-i":
                    input = Paths.get(requireValue(args, ++i));
                    break;
                case "--output":
                case "-o":
                    output = Paths.get(requireValue(args, ++i));
                    break;
                case "--separator":
                case "-s":
                    config.separator(requireValue(args, ++i));
                    break;
                case "--vocabulary":
                    vocabularyPath = Paths.get(requireValue(args, ++i));
                    break;
                case "--vocabulary-threshold":
                    vocabularyThreshold = Long.parseLong(requireValue(args, ++i));
                    break;
                case "--glossaries": {
                    List<String> values = new ArrayList<>();
                    i = collectStrings(args, i, values);
                    config.glossaries(values);
                    break;
                }
                case "--rglossaries": {
                    List<String> values = new ArrayList<>();
                    i = collectStrings(args, i, values);
                    config.regexGlossaries(values);
                    break;
                }
                case "--unkchar":
                    config.unknownChar(requireValue(args, ++i));
                    break;
                case "--unktag":
                    config.unknownTag(requireValue(args, ++i));
                    break;
                case "--config":
                    i++;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (codes == null) {
            throw new IllegalArgumentException("--codes is required");
        }
        if (vocabularyThreshold != null) {
            config.vocabularyThreshold(vocabularyThreshold);
        }
        SegmentationConfig segmentation = config.build();

        MergeTable table = MergeTableReader.read(codes);
        Set<String> vocabulary = null;
        if (vocabularyPath != null) {
            vocabulary = VocabularyReader.read(vocabularyPath, segmentation.vocabularyThreshold()).words();
        }
        logger.debug("Effective settings: {}", BpeConfigLoader.toJson(LearnerOptions.defaults(), segmentation));

        BpeEncoder encoder = new BpeEncoder(table, segmentation, vocabulary);
        long lines = 0;
        try (BufferedReader reader = openInput(input);
             Writer writer = openOutput(output)) {
            String line;
            while ((line = reader.readLine()) != null) {
                writer.write(encoder.segment(line));
                writer.write('\n');
                lines++;
            }
        }
        logger.info("Segmented {} lines ({} distinct words cached)", lines, encoder.cacheSize());
    }

    private static void handleSubsetCommand(String[] args) throws IOException {
        Path codes = null;
        Path input = null;
        Path outCodes = null;
        Path bpeVocabulary = null;
        long minCount = 1;
        boolean dictInput = true;

        SegmentationConfig.Builder config = SegmentationConfig.builder();
        Path configPath = findConfig(args);
        if (configPath != null) {
            config = new BpeConfigLoader(configPath).getSegmentationConfig().toBuilder();
        }

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--codes":
                case "-c":
                    codes = Paths.get(requireValue(args, ++i));
                    break;
                case "--input":
                case "-i":
                    input = Paths.get(requireValue(args, ++i));
                    break;
                case "--text-input":
                    dictInput = false;
                    break;
                case "--min-count":
                case "-m":
                    minCount = Long.parseLong(requireValue(args, ++i));
                    break;
                case "--outcodes":
                case "-o":
                    outCodes = Paths.get(requireValue(args, ++i));
                    break;
                case "--bpevocab":
                case "-b":
                    bpeVocabulary = Paths.get(requireValue(args, ++i));
                    break;
                case "--separator":
                case "-s":
                    config.separator(requireValue(args, ++i));
                    break;
                case "--config":
                    i++;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (codes == null) {
            throw new IllegalArgumentException("--codes is required");
        }
        SegmentationConfig segmentation = config.build();

        Vocabulary words;
        try (BufferedReader reader = openInput(input)) {
            words = dictInput ? VocabularyReader.read(reader, 1) : WordCounter.count(reader);
        }
        words = words.withMinCount(minCount);

        MergeTable table = MergeTableReader.read(codes);
        Vocabulary subwords = SubwordVocabularyBuilder.build(new BpeEncoder(table, segmentation), words);

        if (outCodes != null) {
            MergeTable subset = MergeTableSubset.extract(table, subwords.words(), segmentation.separator());
            MergeTableWriter.write(subset, outCodes);
        }
        if (bpeVocabulary != null) {
            VocabularyWriter.write(subwords, bpeVocabulary);
        } else if (outCodes == null) {
            try (Writer writer = openOutput(null)) {
                VocabularyWriter.write(subwords, writer);
            }
        }
    }

    private static Path findConfig(String[] args) {
        for (int i = 1; i < args.length - 1; i++) {
            if (args[i].equals("--config")) {
                return Paths.get(args[i + 1]);
            }
        }
        return null;
    }

    private static String requireValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for option " + args[index - 1]);
        }
        return args[index];
    }

    /**
     * Consumes the values following option {@code args[index]} up to the next option.
     * Returns the index of the last consumed argument.
     */
    private static int collectStrings(String[] args, int index, List<String> values) {
        int i = index + 1;
        while (i < args.length && !(args[i].startsWith("-") && args[i].length() > 1)) {
            values.add(args[i]);
            i++;
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Missing value for option " + args[index]);
        }
        return i - 1;
    }

    private static int collectValues(String[] args, int index, List<Path> paths) {
        List<String> values = new ArrayList<>();
        int last = collectStrings(args, index, values);
        values.forEach(value -> paths.add(Paths.get(value)));
        return last;
    }

    private static BufferedReader openInput(Path input) throws IOException {
        if (input == null) {
            return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return Files.newBufferedReader(input, StandardCharsets.UTF_8);
    }

    /**
     * Opens the output file, or wraps stdout without closing it.
     */
    private static Writer openOutput(Path output) throws IOException {
        if (output == null) {
            return new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)) {
                @Override
                public void close() throws IOException {
                    flush();
                }
            };
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newBufferedWriter(output, StandardCharsets.UTF_8);
    }

    private static final class LearnArguments {
        private final List<Path> inputs = new ArrayList<>();
        private final List<Path> vocabularyOutputs = new ArrayList<>();
        private Path output;
        private boolean dictInput;
        private LearnerOptions.Builder learn = LearnerOptions.builder();
        private SegmentationConfig.Builder apply = SegmentationConfig.builder();

        LearnerOptions options() {
            return learn.build();
        }

        SegmentationConfig segmentation() {
            return apply.build();
        }
    }
}
