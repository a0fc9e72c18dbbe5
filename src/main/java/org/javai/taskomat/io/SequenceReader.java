package org.javai.taskomat.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.javai.taskomat.sequence.Sequence;
import org.javai.taskomat.sequence.SequenceException;
import org.javai.taskomat.step.Step;
import org.javai.taskomat.step.StepType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Builds sequences from JSON or YAML documents.
 * <p>
 * The resulting sequence is indented but its syntax is not checked; use
 * {@link Sequence#checkSyntax()} or {@link org.javai.taskomat.sequence.SequenceValidator}
 * before executing it.
 */
public class SequenceReader {

	private static final Logger logger = LoggerFactory.getLogger(SequenceReader.class);

	private final ObjectMapper mapper;
	private final Yaml yaml = new Yaml();

	public SequenceReader() {
		this(new ObjectMapper());
	}

	public SequenceReader(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public Sequence fromJson(String json) {
		try {
			return toSequence(mapper.readValue(json, SequenceDocument.class));
		} catch (JsonProcessingException e) {
			throw new SequenceException("Failed to parse sequence from JSON: " + e.getOriginalMessage(), e);
		}
	}

	public Sequence fromYaml(String yamlContent) {
		try {
			return fromYamlData(yaml.load(yamlContent));
		} catch (SequenceException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new SequenceException("Failed to parse sequence from YAML", e);
		}
	}

	/**
	 * Reads a sequence file. Files ending in {@code .json} are read as JSON, files ending in
	 * {@code .yml} or {@code .yaml} as YAML.
	 */
	public Sequence read(Path path) {
		String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
		boolean json = fileName.endsWith(".json");
		if (!json && !fileName.endsWith(".yml") && !fileName.endsWith(".yaml")) {
			throw new SequenceException("Unsupported sequence file type: " + path);
		}
		logger.debug("Reading sequence from {}", path);

		try (Reader reader = Files.newBufferedReader(path)) {
			return json
					? toSequence(mapper.readValue(reader, SequenceDocument.class))
					: fromYamlData(yaml.load(reader));
		} catch (IOException e) {
			throw new SequenceException("Failed to read sequence from path: " + path, e);
		} catch (SequenceException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new SequenceException("Failed to parse sequence from path: " + path, e);
		}
	}

	private Sequence fromYamlData(Object data) {
		if (!(data instanceof Map)) {
			throw new SequenceException("Sequence document must be a mapping");
		}
		try {
			return toSequence(mapper.convertValue(data, SequenceDocument.class));
		} catch (IllegalArgumentException e) {
			throw new SequenceException("Invalid sequence document: " + e.getMessage(), e);
		}
	}

	private Sequence toSequence(SequenceDocument document) {
		if (document == null) {
			throw new SequenceException("Sequence document is empty");
		}
		if (document.steps() == null) {
			throw new SequenceException("Missing required 'steps' section");
		}

		Sequence sequence = new Sequence(document.label());
		int stepNumber = 1;
		for (SequenceDocument.StepDocument stepDocument : document.steps()) {
			sequence.addStep(toStep(stepDocument, stepNumber++));
		}

		logger.debug("Loaded {}", sequence);
		return sequence;
	}

	private Step toStep(SequenceDocument.StepDocument document, int stepNumber) {
		if (document == null || document.type() == null) {
			throw new SequenceException("Step " + stepNumber + " has no type");
		}
		try {
			return new Step(StepType.fromKeyword(document.type()), document.label());
		} catch (IllegalArgumentException e) {
			throw new SequenceException("Step " + stepNumber + ": " + e.getMessage(), e);
		}
	}
}
