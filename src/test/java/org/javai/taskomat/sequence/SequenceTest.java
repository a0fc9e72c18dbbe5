package org.javai.taskomat.sequence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.taskomat.sequence.SequenceIndenterTest.levels;
import static org.javai.taskomat.step.StepType.ACTION;
import static org.javai.taskomat.step.StepType.CATCH;
import static org.javai.taskomat.step.StepType.ELSE;
import static org.javai.taskomat.step.StepType.ELSE_IF;
import static org.javai.taskomat.step.StepType.END;
import static org.javai.taskomat.step.StepType.IF;
import static org.javai.taskomat.step.StepType.TRY;
import static org.javai.taskomat.step.StepType.WHILE;

import java.util.List;
import org.javai.taskomat.step.Step;
import org.javai.taskomat.step.StepType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class SequenceTest {

	private static Sequence sequence(StepType... types) {
		Sequence sequence = new Sequence("test sequence");
		for (StepType type : types) {
			sequence.addStep(new Step(type));
		}
		return sequence;
	}

	@Test
	void labelMayNotBeEmpty() {
		assertThatThrownBy(() -> new Sequence(""))
				.isInstanceOf(SequenceException.class)
				.hasMessage("Sequence label may not be empty");
		assertThatThrownBy(() -> new Sequence(null))
				.isInstanceOf(SequenceException.class);
	}

	@Test
	void labelMayNotExceedMaximumLength() {
		String label = "abcdefghijABCDEFGHIJabcdefghijABCDEFGHIJabcdefghijABCDEFGHIJabcde";

		assertThatThrownBy(() -> new Sequence(label))
				.isInstanceOf(SequenceException.class)
				.hasMessage("Label \"" + label + "\" is too long (>64 characters)");
	}

	@Test
	void labelOfMaximumLengthIsAccepted() {
		String label = "x".repeat(Sequence.MAX_LABEL_LENGTH);

		assertThat(new Sequence(label).getLabel()).isEqualTo(label);
	}

	@Test
	void setLabelAppliesTheSameCheck() {
		Sequence sequence = new Sequence("initial");

		assertThatThrownBy(() -> sequence.setLabel("")).isInstanceOf(SequenceException.class);
		assertThat(sequence.getLabel()).isEqualTo("initial");

		sequence.setLabel("renamed");
		assertThat(sequence.getLabel()).isEqualTo("renamed");
	}

	@Test
	void addStepKeepsIndentationCurrent() {
		Sequence sequence = sequence(TRY, ACTION);

		assertThat(levels(sequence.getSteps())).containsExactly(0, 1);
		assertThat(sequence.getIndentationError()).isPresent();

		sequence.addStep(new Step(CATCH));
		sequence.addStep(new Step(END));

		assertThat(levels(sequence.getSteps())).containsExactly(0, 1, 0, 0);
		assertThat(sequence.getIndentationError()).isEmpty();
		assertThat(sequence.size()).isEqualTo(4);
	}

	@Test
	void stepsViewIsReadOnly() {
		Sequence sequence = sequence(ACTION);

		assertThatThrownBy(() -> sequence.getSteps().add(new Step(ACTION)))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void newSequenceIsEmptyAndValid() {
		Sequence sequence = new Sequence("empty");

		assertThat(sequence.isEmpty()).isTrue();
		assertThat(sequence.checkCorrectnessOfSteps()).isTrue();
	}

	@Test
	void actionsOnlyAreValidAtLevelZero() {
		Sequence sequence = sequence(ACTION, ACTION, ACTION);

		assertThat(sequence.checkCorrectnessOfSteps()).isTrue();
		assertThat(levels(sequence.getSteps())).containsOnly(0);
	}

	@Test
	void tryCatchEnd() {
		assertThat(sequence(TRY, ACTION, CATCH, END).checkCorrectnessOfSteps()).isTrue();
	}

	@Test
	void tryCatchActionEnd() {
		Sequence sequence = sequence(TRY, ACTION, CATCH, ACTION, END);

		assertThat(sequence.checkCorrectnessOfSteps()).isTrue();
		assertThat(levels(sequence.getSteps())).containsExactly(0, 1, 0, 1, 0);
	}

	@Test
	void tryTryCatchEndCatchEnd() {
		assertThat(sequence(TRY, TRY, ACTION, CATCH, ACTION, END, CATCH, ACTION, END)
				.checkCorrectnessOfSteps()).isTrue();
	}

	@Test
	void faultForTry() {
		assertThatThrownBy(() -> sequence(TRY).checkCorrectnessOfSteps())
				.isInstanceOf(SequenceException.class);
	}

	@Test
	void faultForTryTry() {
		assertThatThrownBy(() -> sequence(TRY, TRY).checkCorrectnessOfSteps())
				.isInstanceOf(SequenceException.class)
				.hasMessageContaining("there must be one END");
	}

	@Test
	void faultForTryCatchWithoutEnd() {
		assertThatThrownBy(() -> sequence(TRY, ACTION, CATCH).checkCorrectnessOfSteps())
				.isInstanceOf(SequenceException.class);
	}

	@Test
	void faultForTryEnd() {
		assertThatThrownBy(() -> sequence(TRY, END).checkCorrectnessOfSteps())
				.isInstanceOf(SequenceSyntaxException.class)
				.hasMessage("[syntax check] Step 1: TRY without matching CATCH");
	}

	@Test
	void faultForTryCatchCatchEnd() {
		assertThatThrownBy(() -> sequence(TRY, ACTION, CATCH, CATCH, END).checkCorrectnessOfSteps())
				.isInstanceOf(SequenceSyntaxException.class);
	}

	@Test
	void ifVariants() {
		assertThat(sequence(IF, ACTION, END).checkCorrectnessOfSteps()).isTrue();
		assertThat(sequence(IF, ACTION, ELSE, ACTION, END).checkCorrectnessOfSteps()).isTrue();
		assertThat(sequence(IF, ACTION, ELSE_IF, ACTION, ELSE, ACTION, END).checkCorrectnessOfSteps()).isTrue();
		assertThat(sequence(IF, ACTION, ELSE_IF, ACTION, ELSE_IF, ACTION, ELSE, ACTION, END)
				.checkCorrectnessOfSteps()).isTrue();
	}

	@Test
	void elseIfAfterElse() {
		assertThatThrownBy(() -> sequence(IF, ACTION, ELSE, ACTION, ELSE_IF, ACTION, END).checkSyntax())
				.isInstanceOf(SequenceSyntaxException.class)
				.hasMessageContaining("ELSE IF after ELSE clause");
	}

	@Test
	void duplicateElse() {
		assertThatThrownBy(() -> sequence(IF, ACTION, ELSE, ACTION, ELSE, ACTION, END).checkSyntax())
				.isInstanceOf(SequenceSyntaxException.class)
				.hasMessageContaining("Duplicate ELSE clause");
	}

	@Test
	void ifElseIfTryCatchEndElseEnd() {
		assertThat(sequence(IF, ACTION, ELSE_IF, TRY, ACTION, CATCH, ACTION, END, ELSE, ACTION, END)
				.checkCorrectnessOfSteps()).isTrue();
	}

	@Test
	void ifElseIfWhileEndElseEnd() {
		assertThat(sequence(IF, ACTION, ELSE_IF, WHILE, END, ELSE, ACTION, END)
				.checkCorrectnessOfSteps()).isTrue();
	}

	@Test
	void missingInnerEndFailsAtAnyDepth() {
		assertThatThrownBy(() -> sequence(IF, ACTION, ELSE_IF, TRY, ACTION, CATCH, ELSE, ACTION, END)
				.checkCorrectnessOfSteps())
				.isInstanceOf(SequenceException.class);
		assertThatThrownBy(() -> sequence(WHILE, WHILE, IF, TRY, ACTION, CATCH, ACTION, END, END, END)
				.checkCorrectnessOfSteps())
				.isInstanceOf(SequenceException.class);
	}

	@Test
	void loneEndFailsAtStepOne() {
		assertThatThrownBy(() -> sequence(END).checkSyntax())
				.isInstanceOf(SequenceException.class)
				.hasMessageContaining("Step 1: END without matching IF/WHILE/TRY");
	}

	@ParameterizedTest
	@EnumSource(value = StepType.class, names = { "IF", "WHILE", "TRY", "CATCH", "ELSE", "ELSE_IF" })
	void endFollowedByAnyBlockStepFails(StepType next) {
		Sequence sequence = sequence(END, next);

		assertThatThrownBy(sequence::checkSyntax)
				.isInstanceOf(SequenceException.class)
				.hasMessageContaining("without matching")
				.hasMessageContaining("Step 1");
	}

	@Test
	void checkSyntaxReportsIndentationErrorWithoutStepPosition() {
		Sequence sequence = sequence(IF, ACTION);

		assertThatThrownBy(sequence::checkSyntax)
				.isExactlyInstanceOf(SequenceException.class)
				.hasMessage("Steps are not nested correctly (there must be one END for each IF, TRY, WHILE)");
	}

	@Test
	void indentAfterChangingAStepTypeClearsThePreviousError() {
		Sequence sequence = sequence(IF, ACTION, ACTION);
		assertThat(sequence.getIndentationError()).isPresent();

		sequence.getSteps().get(2).setType(END);
		sequence.indent();

		assertThat(sequence.getIndentationError()).isEmpty();
		assertThatCode(sequence::checkSyntax).doesNotThrowAnyException();
	}

	@Test
	void indentIsIdempotent() {
		Sequence sequence = sequence(WHILE, IF, ACTION, ELSE, TRY, CATCH, END, END, END);
		List<Integer> before = levels(sequence.getSteps());

		sequence.indent();
		sequence.indent();

		assertThat(levels(sequence.getSteps())).isEqualTo(before);
		assertThat(sequence.getIndentationError()).isEmpty();
	}
}
