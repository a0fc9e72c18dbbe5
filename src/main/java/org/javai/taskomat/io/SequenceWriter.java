package org.javai.taskomat.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.List;
import org.javai.taskomat.sequence.Sequence;
import org.javai.taskomat.sequence.SequenceException;
import org.javai.taskomat.step.Step;

/**
 * Writes sequences as JSON documents readable by {@link SequenceReader}.
 */
public class SequenceWriter {

	private final ObjectMapper mapper;

	public SequenceWriter() {
		this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
	}

	public SequenceWriter(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public String toJson(Sequence sequence) {
		try {
			return mapper.writeValueAsString(toDocument(sequence));
		} catch (JsonProcessingException e) {
			throw new SequenceException("Failed to write sequence '" + sequence.getLabel() + "' as JSON", e);
		}
	}

	static SequenceDocument toDocument(Sequence sequence) {
		List<SequenceDocument.StepDocument> steps = sequence.getSteps().stream()
				.map(SequenceWriter::toStepDocument)
				.toList();
		return new SequenceDocument(sequence.getLabel(), steps);
	}

	private static SequenceDocument.StepDocument toStepDocument(Step step) {
		return new SequenceDocument.StepDocument(
				step.getType().name(),
				step.getLabel().isEmpty() ? null : step.getLabel(),
				(int) step.getIndentationLevel());
	}
}
