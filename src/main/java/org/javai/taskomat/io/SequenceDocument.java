package org.javai.taskomat.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Document form of a sequence, shared by the JSON and YAML readers.
 *
 * <p>Example JSON:
 * <pre>
 * {
 *   "label": "pump down",
 *   "steps": [
 *     { "type": "TRY" },
 *     { "type": "ACTION", "label": "open valve" },
 *     { "type": "CATCH" },
 *     { "type": "END" }
 *   ]
 * }
 * </pre>
 *
 * @param label the sequence label
 * @param steps the steps in sequence order
 */
public record SequenceDocument(
		@JsonProperty("label") String label,
		@JsonProperty("steps") List<StepDocument> steps
) {

	/**
	 * @param type step type name or keyword, see
	 *            {@link org.javai.taskomat.step.StepType#fromKeyword(String)}
	 * @param label optional step label
	 * @param indentationLevel written for display; ignored when reading
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record StepDocument(
			@JsonProperty("type") String type,
			@JsonProperty("label") String label,
			@JsonProperty("indentationLevel") Integer indentationLevel
	) {
	}
}
