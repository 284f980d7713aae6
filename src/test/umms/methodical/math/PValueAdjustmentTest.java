package umms.methodical.math;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

import umms.methodical.exception.InvalidMethodException;

class PValueAdjustmentTest {

	private static final double[] P = {0.01, 0.04, 0.03, 0.5};

	@Test
	void benjaminiHochberg() {
		double[] q = PValueAdjustment.BH.adjust(P);

		assertThat(q[0]).isCloseTo(0.04, within(1e-12));
		assertThat(q[1]).isCloseTo(0.16 / 3, within(1e-12));
		assertThat(q[2]).isCloseTo(0.16 / 3, within(1e-12));
		assertThat(q[3]).isCloseTo(0.5, within(1e-12));
		assertThat(PValueAdjustment.FDR.adjust(P)).containsExactly(q);
	}

	@Test
	void bonferroniCapsAtOne() {
		assertThat(PValueAdjustment.BONFERRONI.adjust(P)).containsExactly(new double[] {0.04, 0.16, 0.12, 1.0}, within(1e-12));
	}

	@Test
	void holmIsStepDown() {
		assertThat(PValueAdjustment.HOLM.adjust(P)).containsExactly(new double[] {0.04, 0.09, 0.09, 0.5}, within(1e-12));
	}

	@Test
	void hochbergIsStepUp() {
		assertThat(PValueAdjustment.HOCHBERG.adjust(P)).containsExactly(new double[] {0.04, 0.08, 0.08, 0.5}, within(1e-12));
	}

	@Test
	void benjaminiYekutieli() {
		double harmonic = 1 + 1.0 / 2 + 1.0 / 3 + 1.0 / 4;
		double[] q = PValueAdjustment.BY.adjust(P);

		assertThat(q[0]).isCloseTo(0.04 * harmonic, within(1e-12));
		assertThat(q[1]).isCloseTo(0.16 / 3 * harmonic, within(1e-12));
		assertThat(q[3]).isEqualTo(1.0);
	}

	@Test
	void hommelLiesBetweenRawAndHochberg() {
		double[] hommel = PValueAdjustment.HOMMEL.adjust(P);
		double[] hochberg = PValueAdjustment.HOCHBERG.adjust(P);

		for (int i = 0; i < P.length; i++) {
			assertThat(hommel[i]).isBetween(P[i], hochberg[i]);
		}
	}

	@Test
	void missingValuesStayMissingAndAreNotCounted() {
		double[] q = PValueAdjustment.BONFERRONI.adjust(new double[] {0.01, Double.NaN, 0.02});

		assertThat(q[0]).isCloseTo(0.02, within(1e-12));
		assertThat(q[1]).isNaN();
		assertThat(q[2]).isCloseTo(0.04, within(1e-12));
	}

	@Test
	void noneReturnsInput() {
		assertThat(PValueAdjustment.NONE.adjust(P)).containsExactly(P);
	}

	@Test
	void namesFollowPAdjust() {
		assertThat(PValueAdjustment.fromName("BH")).isEqualTo(PValueAdjustment.BH);
		assertThat(PValueAdjustment.fromName("hommel")).isEqualTo(PValueAdjustment.HOMMEL);
		assertThatThrownBy(() -> PValueAdjustment.fromName("bh")).isInstanceOf(InvalidMethodException.class);
		assertThatThrownBy(() -> PValueAdjustment.fromName("storey")).isInstanceOf(InvalidMethodException.class);
	}

	@Test
	void correlationMethodAcceptsPrefixes() {
		assertThat(CorrelationMethod.fromName("spear")).isEqualTo(CorrelationMethod.SPEARMAN);
		assertThat(CorrelationMethod.fromName("Pearson")).isEqualTo(CorrelationMethod.PEARSON);
		assertThatThrownBy(() -> CorrelationMethod.fromName("kendall")).isInstanceOf(InvalidMethodException.class);
		assertThatThrownBy(() -> CorrelationMethod.fromName("")).isInstanceOf(InvalidMethodException.class);
	}
}
