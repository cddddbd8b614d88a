package work.stepweave.engine.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stepweave.engine.error.WorkflowDefinitionException;
import work.stepweave.engine.model.CollectionOperation;
import work.stepweave.engine.model.CollectionStage;
import work.stepweave.engine.model.CollectionStep;
import work.stepweave.engine.model.ConcurrencyPolicy;
import work.stepweave.engine.model.ConditionalBranch;
import work.stepweave.engine.model.ConditionalStep;
import work.stepweave.engine.model.GenerativeCallStep;
import work.stepweave.engine.model.InputParameter;
import work.stepweave.engine.model.ItemErrorPolicy;
import work.stepweave.engine.model.ItemErrorPolicy.ConditionFailure;
import work.stepweave.engine.model.ItemErrorPolicy.ItemFailure;
import work.stepweave.engine.model.OnError;
import work.stepweave.engine.model.OutputSpec;
import work.stepweave.engine.model.ParameterType;
import work.stepweave.engine.model.Step;
import work.stepweave.engine.model.TextTransformStep;
import work.stepweave.engine.model.TransformSpec;
import work.stepweave.engine.model.ValidationConfig;
import work.stepweave.engine.model.Workflow;

/**
 * Reads YAML (or JSON) workflow documents into the immutable {@link Workflow} model. Everything that can be
 * checked without an evaluator is checked here; referenced schema files are read relative to the workflow.
 */
public final class WorkflowLoader {
    private static final Logger log = LoggerFactory.getLogger(WorkflowLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};
    private static final Pattern WORKFLOW_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9 _-]*");
    private static final Pattern PYTHON_NAMED_GROUP = Pattern.compile("\\(\\?P<");
    private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([A-Za-z][A-Za-z0-9]*)>");

    public Workflow load(Path path) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new WorkflowDefinitionException(path.toString(), "Failed to read workflow file: " + ex.getMessage(), ex);
        }
        var baseDir = path.toAbsolutePath().getParent();
        log.debug("Loading workflow {}", path);
        return parse(text, baseDir);
    }

    public Workflow parse(String document, Path baseDir) {
        Map<String, Object> raw;
        try {
            raw = YAML_MAPPER.readValue(document, MAP_REF);
        } catch (JsonProcessingException ex) {
            throw new WorkflowDefinitionException(null, "Invalid YAML/JSON syntax: " + ex.getOriginalMessage(), ex);
        }
        if (raw == null) {
            throw new WorkflowDefinitionException(null, "Empty workflow document");
        }
        return new Parser(baseDir).workflow(new DocumentNode(raw, ""));
    }

    private static final class Parser {
        private final Path baseDir;

        Parser(Path baseDir) {
            this.baseDir = baseDir;
        }

        Workflow workflow(DocumentNode root) {
            var name = root.requiredString("name");
            if (!name.equals(name.strip())) {
                throw root.fail("name", "cannot have leading or trailing spaces");
            }
            if (!WORKFLOW_NAME.matcher(name).matches()) {
                throw root.fail("name", "must start with a letter and contain only ASCII letters, digits, '-', '_' and spaces");
            }
            var steps = steps(root, "steps");
            if (steps.isEmpty()) {
                throw root.fail("steps", "at least one step is required");
            }
            return new Workflow(
                name,
                root.string("description"),
                root.has("version") ? root.string("version") : "1.0",
                inputParameters(root),
                steps,
                output(root.child("output")));
        }

        private List<InputParameter> inputParameters(DocumentNode root) {
            var parameters = new ArrayList<InputParameter>();
            var seen = new HashSet<String>();
            for (var node : root.children("input_parameters")) {
                var name = node.requiredString("name");
                if (!seen.add(name)) {
                    throw node.fail("name", "duplicate input parameter '" + name + "'");
                }
                parameters.add(new InputParameter(
                    name,
                    guarded(node, "type", () -> ParameterType.from(node.string("type"))),
                    node.bool("required", true),
                    node.raw("default"),
                    node.string("description")));
            }
            return parameters;
        }

        private OutputSpec output(DocumentNode node) {
            if (node == null) {
                return OutputSpec.DEFAULT;
            }
            return new OutputSpec(guarded(node, "format", () -> OutputSpec.Format.from(node.string("format"))), node.string("template"));
        }

        private List<Step> steps(DocumentNode parent, String key) {
            var steps = new ArrayList<Step>();
            var ids = new HashSet<String>();
            for (var node : parent.children(key)) {
                var step = step(node);
                if (!ids.add(step.id())) {
                    throw node.fail("id", "duplicate step id '" + step.id() + "'");
                }
                steps.add(step);
            }
            return steps;
        }

        private Step step(DocumentNode node) {
            var id = node.requiredString("id");
            var type = node.requiredString("type");
            var onError = guarded(node, "on_error", () -> OnError.from(node.string("on_error")));
            return switch (type) {
                case GenerativeCallStep.TYPE -> generativeCall(node, id, onError);
                case TextTransformStep.TYPE -> textTransform(node, id, onError);
                case CollectionStep.TYPE -> collection(node, id, onError);
                case ConditionalStep.TYPE -> conditional(node, id, onError);
                default -> throw node.fail("type", "unknown step type '" + type + "' (expected ai_call|text_process|collection|conditional)");
            };
        }

        private GenerativeCallStep generativeCall(DocumentNode node, String id, OnError onError) {
            var model = node.string("model");
            var provider = node.string("provider");
            if (provider != null && !provider.isBlank()) {
                if (model == null || model.isBlank()) {
                    throw node.fail("provider", "requires 'model'");
                }
                if (!model.contains("/")) {
                    model = provider + "/" + model;
                }
            }
            var resolvedModel = model == null || model.isBlank() ? null : model;
            var aiParams = node.map("ai_params");
            var validation = node.child("validation");
            return construct(node, () -> new GenerativeCallStep(
                id,
                node.string("description"),
                onError,
                node.requiredString("prompt"),
                resolvedModel,
                node.decimal("temperature", 0.0, 2.0),
                node.integer("max_tokens", 1, Integer.MAX_VALUE),
                aiParams,
                node.integer("max_auto_retry_attempts", 0, Integer.MAX_VALUE),
                node.duration("timeout"),
                validation == null ? null : validation(validation)));
        }

        private ValidationConfig validation(DocumentNode node) {
            var schema = schema(node);
            var validator = node.string("custom_validator");
            boolean hasValidator = validator != null && !validator.isBlank();
            if (schema == null && !hasValidator) {
                throw node.fail("requires 'schema', 'schema_file' or 'custom_validator'");
            }
            if (schema != null && hasValidator) {
                throw node.fail("'schema' and 'custom_validator' are mutually exclusive");
            }
            var extract = node.string("extract_json_pattern");
            if (extract != null) {
                compile(node, "extract_json_pattern", extract, Pattern.DOTALL);
            }
            var maxRetries = node.integer("max_retries", 0, ValidationConfig.MAX_RETRIES_LIMIT);
            return construct(node, () -> new ValidationConfig(
                schema,
                hasValidator ? validator : null,
                node.map("criteria"),
                maxRetries == null ? ValidationConfig.DEFAULT_MAX_RETRIES : maxRetries,
                node.string("retry_prompt"),
                node.bool("allow_partial_success", false),
                extract,
                node.bool("force_json_output", false),
                node.string("json_wrapper_instruction")));
        }

        private TextTransformStep textTransform(DocumentNode node, String id, OnError onError) {
            var method = node.requiredString("method");
            if (!node.has("input")) {
                throw node.fail("input", "is required");
            }
            var transform = transform(node, method);
            return construct(node, () -> new TextTransformStep(id, node.string("description"), onError, node.string("input"), transform));
        }

        private TransformSpec transform(DocumentNode node, String method) {
            return construct(node, () -> switch (method) {
                case "split" -> new TransformSpec.Split(node.requiredString("separator"), node.integer("max_splits", 0, Integer.MAX_VALUE));
                case "extract_between_marker" -> new TransformSpec.ExtractBetween(
                    node.string("begin"), node.string("end"), node.bool("extract_all", false));
                case "regex_extract" -> regexExtract(node);
                case "select_item" -> new TransformSpec.SelectItem(node.integer("index"), node.string("slice"), node.string("condition"));
                case "parse_as_json" -> parseAsJson(node);
                case "replace" -> replace(node);
                case "json_parse" -> new TransformSpec.JsonParse();
                case "yaml_parse" -> new TransformSpec.YamlParse();
                case "csv_parse", "tsv_parse" -> new TransformSpec.CsvParse(method, delimiter(node), node.bool("strict_validation", true));
                case "format" -> new TransformSpec.Format(node.string("template"));
                case "markdown_split" -> new TransformSpec.MarkdownSplit(
                    guarded(node, "split_type", () -> TransformSpec.MarkdownSplit.SplitType.from(node.string("split_type"))),
                    node.integer("header_level"),
                    node.bool("preserve_metadata", true));
                case "fixed_split" -> new TransformSpec.FixedSplit(
                    splitByTokens(node),
                    requiredInteger(node, "size"),
                    node.integer("overlap") == null ? 0 : node.integer("overlap"),
                    node.bool("preserve_boundaries", true));
                case "array_filter" -> new TransformSpec.ArrayFilter(node.string("condition"));
                case "array_transform" -> new TransformSpec.ArrayTransform(node.string("transform_expression"));
                case "array_sort" -> new TransformSpec.ArraySort(node.string("sort_key"), node.bool("sort_reverse", false));
                case "array_aggregate" -> new TransformSpec.ArrayAggregate(
                    guarded(node, "aggregate_operation",
                        () -> TransformSpec.ArrayAggregate.Aggregation.from(node.string("aggregate_operation"))),
                    node.string("separator"));
                default -> throw node.fail("method", "unknown text method '" + method + "'");
            });
        }

        private TransformSpec regexExtract(DocumentNode node) {
            var source = PYTHON_NAMED_GROUP.matcher(node.requiredString("pattern")).replaceAll("(?<");
            var pattern = compile(node, "pattern", source, regexFlags(node));
            var names = new ArrayList<String>();
            Matcher matcher = NAMED_GROUP.matcher(source);
            while (matcher.find()) {
                names.add(matcher.group(1));
            }
            var outputFormat = node.has("output_format") ? node.string("output_format").trim().toLowerCase(Locale.ROOT) : "string";
            if (!outputFormat.equals("string") && !outputFormat.equals("array")) {
                throw node.fail("output_format", "expected string or array but got '" + outputFormat + "'");
            }
            var group = node.string("group");
            if (group != null && !group.chars().allMatch(Character::isDigit) && !names.contains(group)) {
                throw node.fail("group", "pattern has no group named '" + group + "'");
            }
            return new TransformSpec.RegexExtract(pattern, group, names, outputFormat.equals("array"));
        }

        private int regexFlags(DocumentNode node) {
            var raw = node.raw("flags");
            if (raw == null) {
                return 0;
            }
            List<String> names = new ArrayList<>();
            if (raw instanceof List<?> list) {
                list.forEach(item -> names.add(String.valueOf(item)));
            } else {
                names.addAll(List.of(String.valueOf(raw).split("[|,\\s]+")));
            }
            int flags = 0;
            for (var name : names) {
                if (name.isBlank()) {
                    continue;
                }
                flags |= switch (name.trim().toUpperCase(Locale.ROOT)) {
                    case "IGNORECASE", "I" -> Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                    case "MULTILINE", "M" -> Pattern.MULTILINE;
                    case "DOTALL", "S" -> Pattern.DOTALL;
                    case "VERBOSE", "X" -> Pattern.COMMENTS;
                    default -> throw node.fail("flags", "unknown regex flag '" + name + "' (expected IGNORECASE|MULTILINE|DOTALL|VERBOSE)");
                };
            }
            return flags;
        }

        private TransformSpec parseAsJson(DocumentNode node) {
            var schema = schema(node);
            String source = null;
            if (node.has("schema_file")) {
                source = node.string("schema_file");
            } else if (schema != null) {
                source = "inline";
            }
            return new TransformSpec.ParseAsJson(schema, source, node.bool("strict_validation", false), node.bool("format_output", false));
        }

        private TransformSpec replace(DocumentNode node) {
            var rules = node.children("replacements");
            if (rules.isEmpty()) {
                throw node.fail("replacements", "at least one replacement rule is required");
            }
            var replacements = new ArrayList<TransformSpec.Replacement>();
            for (var rule : rules) {
                var pattern = rule.has("pattern") ? compile(rule, "pattern", rule.string("pattern"), 0) : null;
                var to = rule.has("to") ? rule.string("to") : "";
                replacements.add(construct(rule, () -> new TransformSpec.Replacement(rule.string("from"), pattern, to)));
            }
            return new TransformSpec.Replace(replacements);
        }

        private Character delimiter(DocumentNode node) {
            var raw = node.string("delimiter");
            if (raw == null) {
                return null;
            }
            var normalized = raw.equals("\\t") || raw.equalsIgnoreCase("tab") ? "\t" : raw;
            if (normalized.length() != 1) {
                throw node.fail("delimiter", "must be a single character but was '" + raw + "'");
            }
            return normalized.charAt(0);
        }

        private boolean splitByTokens(DocumentNode node) {
            var splitBy = node.has("split_by") ? node.string("split_by").trim().toLowerCase(Locale.ROOT) : "characters";
            return switch (splitBy) {
                case "characters" -> false;
                case "tokens" -> true;
                default -> throw node.fail("split_by", "expected characters or tokens but got '" + splitBy + "'");
            };
        }

        private CollectionStep collection(DocumentNode node, String id, OnError onError) {
            var operation = guarded(node, "operation", () -> CollectionOperation.from(node.string("operation")));
            if (!node.has("input")) {
                throw node.fail("input", "is required");
            }
            List<CollectionStage> stages = new ArrayList<>();
            if (operation == CollectionOperation.PIPELINE) {
                var stageNodes = node.children("pipeline");
                if (stageNodes.isEmpty()) {
                    throw node.fail("pipeline", "at least one stage is required");
                }
                var stageIds = new HashSet<String>();
                for (int i = 0; i < stageNodes.size(); i++) {
                    var stageNode = stageNodes.get(i);
                    var stageId = stageNode.has("id") ? stageNode.string("id") : "stage_" + (i + 1);
                    if (!stageIds.add(stageId)) {
                        throw stageNode.fail("id", "duplicate stage id '" + stageId + "'");
                    }
                    var stageOperation = guarded(stageNode, "operation", () -> CollectionOperation.from(stageNode.string("operation")));
                    if (stageOperation == CollectionOperation.PIPELINE) {
                        throw stageNode.fail("operation", "pipeline stages cannot be nested");
                    }
                    stages.add(stage(stageNode, stageId, stageOperation));
                }
            } else {
                stages.add(stage(node, id, operation));
            }
            var concurrency = node.child("concurrency");
            var errorHandling = node.child("error_handling");
            return construct(node, () -> new CollectionStep(
                id,
                node.string("description"),
                onError,
                operation,
                node.string("input"),
                stages,
                concurrency == null ? null : concurrency(concurrency),
                errorHandling == null ? null : itemErrorPolicy(errorHandling)));
        }

        private CollectionStage stage(DocumentNode node, String id, CollectionOperation operation) {
            var steps = steps(node, "steps");
            var condition = node.string("condition");
            switch (operation) {
                case MAP, REDUCE -> {
                    if (steps.isEmpty()) {
                        throw node.fail("steps", operation.code() + " requires at least one nested step");
                    }
                }
                case FILTER -> {
                    if (steps.isEmpty() && (condition == null || condition.isBlank())) {
                        throw node.fail("filter requires a 'condition' or nested 'steps'");
                    }
                }
                default -> throw node.fail("operation", "unexpected stage operation " + operation.code());
            }
            return construct(node, () -> new CollectionStage(
                id,
                operation,
                steps,
                condition,
                node.raw("initial_value"),
                node.string("accumulator_var"),
                node.string("item_var")));
        }

        private ConcurrencyPolicy concurrency(DocumentNode node) {
            return new ConcurrencyPolicy(
                node.integer("max_parallel", 1, Integer.MAX_VALUE),
                node.integer("batch_size", 1, Integer.MAX_VALUE),
                node.duration("delay_between_batches"));
        }

        private ItemErrorPolicy itemErrorPolicy(DocumentNode node) {
            var maxRetries = node.integer("max_retries_per_item", 0, Integer.MAX_VALUE);
            return construct(node, () -> new ItemErrorPolicy(
                ItemFailure.from(node.string("on_item_failure")),
                ConditionFailure.from(node.string("on_condition_error")),
                maxRetries == null ? ItemErrorPolicy.DEFAULT_MAX_RETRIES_PER_ITEM : maxRetries,
                ItemFailure.from(node.string("on_retry_exhausted")),
                node.bool("preserve_errors", true)));
        }

        private ConditionalStep conditional(DocumentNode node, String id, OnError onError) {
            var onConditionError = guarded(node, "on_condition_error", () -> OnError.from(node.string("on_condition_error")));
            boolean basic = node.has("condition") || node.has("if_true");
            if (basic && node.has("conditions")) {
                throw node.fail("use either 'condition' with 'if_true'/'if_false' or 'conditions', not both");
            }
            List<ConditionalBranch> branches = new ArrayList<>();
            if (basic) {
                var condition = node.requiredString("condition");
                if (!node.has("if_true")) {
                    throw node.fail("if_true", "is required with 'condition'");
                }
                branches.add(new ConditionalBranch(ConditionalStep.IF_TRUE, condition, steps(node, "if_true"), false));
                if (node.has("if_false")) {
                    branches.add(new ConditionalBranch(ConditionalStep.IF_FALSE, null, steps(node, "if_false"), true));
                }
            } else {
                var entries = node.children("conditions");
                if (entries.isEmpty()) {
                    throw node.fail("conditional requires 'condition' with 'if_true', or 'conditions'");
                }
                var names = new HashSet<String>();
                boolean hasDefault = false;
                for (int i = 0; i < entries.size(); i++) {
                    var entry = entries.get(i);
                    var name = entry.has("name") ? entry.string("name") : "condition_" + (i + 1);
                    if (!names.add(name)) {
                        throw entry.fail("name", "duplicate branch name '" + name + "'");
                    }
                    boolean isDefault = entry.bool("default", false);
                    var condition = entry.string("condition");
                    if (isDefault) {
                        if (hasDefault) {
                            throw entry.fail("default", "only one default branch is allowed");
                        }
                        if (condition != null && !condition.isBlank()) {
                            throw entry.fail("condition", "a default branch carries no condition");
                        }
                        hasDefault = true;
                        condition = null;
                    } else if (condition == null || condition.isBlank()) {
                        throw entry.fail("condition", "is required unless the branch is the default");
                    }
                    branches.add(new ConditionalBranch(name, condition, steps(entry, "steps"), isDefault));
                }
            }
            return construct(node, () -> new ConditionalStep(id, node.string("description"), onError, branches, onConditionError, basic));
        }

        private Map<String, Object> schema(DocumentNode node) {
            var inline = node.map("schema");
            if (node.has("schema_file")) {
                if (inline != null) {
                    throw node.fail("'schema' and 'schema_file' are mutually exclusive");
                }
                return readSchemaFile(node, node.string("schema_file"));
            }
            return inline;
        }

        private Map<String, Object> readSchemaFile(DocumentNode node, String file) {
            var path = baseDir == null ? Path.of(file) : baseDir.resolve(file);
            try {
                Map<String, Object> schema = YAML_MAPPER.readValue(Files.readString(path), MAP_REF);
                if (schema == null) {
                    throw node.fail("schema_file", "schema file is empty: " + path);
                }
                return new LinkedHashMap<>(schema);
            } catch (IOException ex) {
                throw new WorkflowDefinitionException(node.path("schema_file"), "Failed to read schema file " + path + ": " + ex.getMessage(), ex);
            }
        }

        private static Pattern compile(DocumentNode node, String key, String source, int flags) {
            try {
                return Pattern.compile(source, flags);
            } catch (PatternSyntaxException ex) {
                throw new WorkflowDefinitionException(node.path(key), "invalid regular expression: " + ex.getDescription(), ex);
            }
        }

        private static int requiredInteger(DocumentNode node, String key) {
            var value = node.integer(key);
            if (value == null) {
                throw node.fail(key, "is required");
            }
            return value;
        }

        private static <T> T guarded(DocumentNode node, String key, Supplier<T> parse) {
            try {
                return parse.get();
            } catch (IllegalArgumentException ex) {
                throw new WorkflowDefinitionException(node.path(key), ex.getMessage(), ex);
            }
        }

        /**
         * Model constructors reject inconsistent values with {@link IllegalArgumentException}; report those
         * against the node being built.
         */
        private static <T> T construct(DocumentNode node, Supplier<T> build) {
            try {
                return build.get();
            } catch (IllegalArgumentException | NullPointerException ex) {
                throw new WorkflowDefinitionException(node.path(), ex.getMessage(), ex);
            }
        }
    }
}
