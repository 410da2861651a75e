package com.deepcheck.common.consensus;

/**
 * Tunable constants for {@link DualSourceConsensusStrategy}.
 *
 * <ul>
 *   <li>{@code agreementBonus}      added to the mean confidence when both sources agree</li>
 *   <li>{@code disagreementPenalty} subtracted from the winner's confidence on an outright contradiction</li>
 *   <li>{@code partialPenalty}      subtracted when one source abstains (UNCERTAIN)</li>
 *   <li>{@code degradedFactor}      multiplier for single-source results, strictly below 1</li>
 * </ul>
 */
public record ConsensusSettings(
    double agreementBonus,
    double disagreementPenalty,
    double partialPenalty,
    double degradedFactor
) {
    public static final ConsensusSettings DEFAULTS = new ConsensusSettings(0.05, 0.20, 0.10, 0.80);

    public ConsensusSettings {
        requireUnit("agreementBonus", agreementBonus);
        requireUnit("disagreementPenalty", disagreementPenalty);
        requireUnit("partialPenalty", partialPenalty);
        if (!(degradedFactor > 0.0 && degradedFactor < 1.0)) {
            throw new IllegalArgumentException("degradedFactor must be within (0,1) but was " + degradedFactor);
        }
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0,1] but was " + value);
        }
    }
}
