package io.evitadb.marginalia.check;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Immutable result of the check action.
 *
 * @param parseFailures   files the parser refused
 * @param roundTripErrors files whose canonical form does not parse back to the same structure
 * @param statistics      node counts summed over all successfully parsed files
 */
public record CheckResult(
	@Nonnull List<ParseFailure> parseFailures,
	@Nonnull List<RoundTripError> roundTripErrors,
	@Nonnull DocumentStatistics statistics
) {

	/**
	 * Creates a new CheckResult with validation and defensive copying.
	 */
	public CheckResult {
		Objects.requireNonNull(parseFailures, "parseFailures must not be null");
		Objects.requireNonNull(roundTripErrors, "roundTripErrors must not be null");
		Objects.requireNonNull(statistics, "statistics must not be null");
		parseFailures = List.copyOf(parseFailures);
		roundTripErrors = List.copyOf(roundTripErrors);
	}

	/**
	 * Returns true if there are no errors of any kind.
	 *
	 * @return true if no file failed
	 */
	public boolean isSuccess() {
		return this.parseFailures.isEmpty() && this.roundTripErrors.isEmpty();
	}

	/**
	 * Returns the total count of all errors.
	 *
	 * @return sum of parse failures and round trip errors
	 */
	public int errorCount() {
		return this.parseFailures.size() + this.roundTripErrors.size();
	}

	/**
	 * Creates an empty successful result.
	 *
	 * @return a CheckResult without errors
	 */
	@Nonnull
	public static CheckResult success() {
		return new CheckResult(List.of(), List.of(), DocumentStatistics.EMPTY);
	}
}
