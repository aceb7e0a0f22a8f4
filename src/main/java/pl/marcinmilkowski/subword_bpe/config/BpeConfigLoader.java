package pl.marcinmilkowski.subword_bpe.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.subword_bpe.apply.SegmentationConfig;
import pl.marcinmilkowski.subword_bpe.codes.BpeVersion;
import pl.marcinmilkowski.subword_bpe.learn.LearnerOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads learning and segmentation settings from JSON.
 *
 * Expected JSON structure (both sections and every key optional):
 * {
 *   "learn": {
 *     "symbols": 10000,
 *     "min_frequency": 2,
 *     "min_count": 1,
 *     "version": "0.2",
 *     "verbose": false,
 *     "force_filter": "[0-9]+"
 *   },
 *   "apply": {
 *     "separator": "@@",
 *     "glossaries": ["USA"],
 *     "regex_glossaries": ["[0-9]+"],
 *     "unk_char": "﷪",
 *     "unk_tag": "&lt;unk&gt;",
 *     "vocabulary_threshold": 1
 *   }
 * }
 * Missing keys keep the defaults of {@link LearnerOptions} and {@link SegmentationConfig}.
 */
public class BpeConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(BpeConfigLoader.class);

    private final LearnerOptions learnerOptions;
    private final SegmentationConfig segmentationConfig;
    private final Path configPath;

    /**
     * Load configuration from the specified path.
     *
     * @param configPath Path to the JSON file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is not valid JSON or a value has the wrong type
     */
    public BpeConfigLoader(Path configPath) throws IOException {
        this.configPath = configPath;

        if (!Files.exists(configPath)) {
            throw new IOException("BPE config file not found: " + configPath);
        }

        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        JSONObject root;
        try {
            // truncated input can fail inside the reader with an index error
            if (!content.isBlank() && !JSON.isValidObject(content)) {
                throw new IllegalArgumentException("Malformed JSON in BPE config " + configPath);
            }
            root = JSON.parseObject(content);
        } catch (JSONException | IndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Malformed JSON in BPE config " + configPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty BPE config: " + configPath);
        }

        try {
            this.learnerOptions = parseLearnerOptions(root.getJSONObject("learn"));
            this.segmentationConfig = parseSegmentationConfig(root.getJSONObject("apply"));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid value in BPE config " + configPath + ": " + e.getMessage(), e);
        }

        logger.info("Loaded BPE config from {}: {} symbols, version {}, separator '{}', {} glossaries",
            configPath, learnerOptions.symbols(), learnerOptions.version(), segmentationConfig.separator(),
            segmentationConfig.glossaries().size() + segmentationConfig.regexGlossaries().size());
    }

    static LearnerOptions parseLearnerOptions(JSONObject learn) {
        LearnerOptions.Builder builder = LearnerOptions.builder();
        if (learn == null) {
            return builder.build();
        }
        if (learn.containsKey("symbols")) {
            builder.symbols(learn.getIntValue("symbols"));
        }
        if (learn.containsKey("min_frequency")) {
            builder.minFrequency(learn.getLongValue("min_frequency"));
        }
        if (learn.containsKey("min_count")) {
            builder.minCount(learn.getLongValue("min_count"));
        }
        if (learn.containsKey("version")) {
            builder.version(BpeVersion.parse(learn.getString("version")));
        }
        if (learn.containsKey("verbose")) {
            builder.verbose(learn.getBooleanValue("verbose"));
        }
        if (learn.containsKey("force_filter")) {
            builder.forcedMergeFilter(learn.getString("force_filter"));
        }
        return builder.build();
    }

    static SegmentationConfig parseSegmentationConfig(JSONObject apply) {
        SegmentationConfig.Builder builder = SegmentationConfig.builder();
        if (apply == null) {
            return builder.build();
        }
        if (apply.containsKey("separator")) {
            builder.separator(apply.getString("separator"));
        }
        if (apply.containsKey("glossaries")) {
            builder.glossaries(stringList(apply.getJSONArray("glossaries")));
        }
        if (apply.containsKey("regex_glossaries")) {
            builder.regexGlossaries(stringList(apply.getJSONArray("regex_glossaries")));
        }
        if (apply.containsKey("unk_char")) {
            builder.unknownChar(apply.getString("unk_char"));
        }
        if (apply.containsKey("unk_tag")) {
            builder.unknownTag(apply.getString("unk_tag"));
        }
        if (apply.containsKey("vocabulary_threshold")) {
            builder.vocabularyThreshold(apply.getLongValue("vocabulary_threshold"));
        }
        return builder.build();
    }

    private static List<String> stringList(JSONArray array) {
        return array == null ? List.of() : array.toJavaList(String.class);
    }

    public LearnerOptions getLearnerOptions() {
        return learnerOptions;
    }

    public SegmentationConfig getSegmentationConfig() {
        return segmentationConfig;
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Export the effective settings in the same shape as the input file.
     */
    public static JSONObject toJson(LearnerOptions learn, SegmentationConfig apply) {
        JSONObject learnObj = new JSONObject();
        learnObj.put("symbols", learn.symbols());
        learnObj.put("min_frequency", learn.minFrequency());
        learnObj.put("min_count", learn.minCount());
        learnObj.put("version", learn.version().toString());
        learnObj.put("verbose", learn.verbose());
        if (learn.forcedMergeFilter() != null) learnObj.put("force_filter", learn.forcedMergeFilter());

        JSONObject applyObj = new JSONObject();
        applyObj.put("separator", apply.separator());
        applyObj.put("glossaries", new JSONArray(apply.glossaries()));
        applyObj.put("regex_glossaries", new JSONArray(apply.regexGlossaries()));
        if (apply.unknownChar() != null) applyObj.put("unk_char", apply.unknownChar());
        if (apply.unknownTag() != null) applyObj.put("unk_tag", apply.unknownTag());
        applyObj.put("vocabulary_threshold", apply.vocabularyThreshold());

        JSONObject root = new JSONObject();
        root.put("learn", learnObj);
        root.put("apply", applyObj);
        return root;
    }
}
