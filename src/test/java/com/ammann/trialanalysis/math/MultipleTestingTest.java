package com.ammann.trialanalysis.math;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class MultipleTestingTest
{

    private static final double[] P_VALUES = {0.01, 0.04, 0.03, 0.005};

    @Test
    void bonferroniMultipliesAndCaps()
    {
        double[] adjusted = MultipleTesting.bonferroni(new double[] {0.01, 0.3, 0.5});

        assertThat(adjusted).containsExactly(new double[] {0.03, 0.9, 1.0}, within(1e-12));
    }

    @Test
    void holmIsMonotoneInRankOrder()
    {
        double[] adjusted = MultipleTesting.holm(P_VALUES);

        // ranks: 0.005 x4, 0.01 x3, 0.03 x2, 0.04 x1
        assertThat(adjusted).containsExactly(new double[] {0.03, 0.06, 0.06, 0.02}, within(1e-12));
    }

    @Test
    void benjaminiHochbergStepsUp()
    {
        double[] adjusted = MultipleTesting.benjaminiHochberg(P_VALUES);

        assertThat(adjusted).containsExactly(new double[] {0.02, 0.04, 0.04, 0.02}, within(1e-12));
    }

    @Test
    void emptyFamilyStaysEmpty()
    {
        assertThat(MultipleTesting.holm(new double[0])).isEmpty();
        assertThat(MultipleTesting.benjaminiHochberg(new double[0])).isEmpty();
    }
}
