/*
 * Copyright (C) 2015-2020 Jakub Galgonek   galgonek@uochb.cas.cz
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU Lesser General
 * Public License as published by the Free Software Foundation; either version 2.1 of the License, or (at your option)
 * any later version. All we ask is that proper credit is given for our work, which includes - but is not limited to -
 * adding the above copyright notice to the beginning of your source code files, and to any copyright notice that you
 * may distribute with programs based on this work.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for more
 * details.
 */
package cz.iocb.isochem.isotopes;

import static cz.iocb.isochem.SpeciesFixtures.ENTROPY;
import static cz.iocb.isochem.SpeciesFixtures.reaction;
import static cz.iocb.isochem.SpeciesFixtures.species;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.isochem.model.Arrhenius;
import cz.iocb.isochem.model.ArrheniusEP;
import cz.iocb.isochem.model.Chebyshev;
import cz.iocb.isochem.model.Constants;
import cz.iocb.isochem.model.Reaction;
import cz.iocb.isochem.model.Species;
import cz.iocb.isochem.molecule.AutomorphismSymmetryNumber;
import cz.iocb.isochem.molecule.StructureIsomorphismOracle;
import cz.iocb.isochem.molecule.SymmetryNumberProvider;



public class SymmetryCorrectorTest
{
    private IsotopeStripper stripper;
    private IsotopomerComparator comparator;
    private SymmetryCorrector corrector;


    @BeforeEach
    public void setUp()
    {
        stripper = new IsotopeStripper();
        comparator = new IsotopomerComparator(new StructureIsomorphismOracle(), stripper);
        corrector = new SymmetryCorrector(new AutomorphismSymmetryNumber(), comparator, stripper);
    }


    private static Reaction bimolecular(String reactant, String other, String product, double factor)
            throws Exception
    {
        return reaction(new Species[] { species("A", reactant), species("B", other) },
                new Species[] { species("P", product) }, new Arrhenius(factor, 0.0, 0.0));
    }


    @Test
    public void entropyGrowsWhenSymmetryIsLost() throws Exception
    {
        Species reference = species("ethane", "CC");
        Species isotopomer = species("ethane", "[13CH3]C");

        corrector.correctEntropy(isotopomer, reference);

        assertThat(isotopomer.getThermo().getEntropy(), closeTo(ENTROPY + Constants.R * Math.log(2), 1e-9));
        assertThat(reference.getThermo().getEntropy(), is(ENTROPY));
    }


    @Test
    public void sharedThermoRecordIsNotModified() throws Exception
    {
        Species reference = species("ethane", "CC");
        Species isotopomer = new Species("ethane", species("ethane", "[13CH3]C").getMolecule(),
                reference.getThermo());

        corrector.correctEntropy(isotopomer, reference);

        assertThat(reference.getThermo().getEntropy(), is(ENTROPY));
        assertThat(isotopomer.getThermo().getEntropy(), closeTo(ENTROPY + Constants.R * Math.log(2), 1e-9));
    }


    @Test
    public void entropyOfEquallySymmetricIsotopomerIsKept() throws Exception
    {
        Species isotopomer = species("ethane", "[13CH3][13CH3]");

        corrector.correctEntropy(isotopomer, species("ethane", "CC"));

        assertThat(isotopomer.getThermo().getEntropy(), closeTo(ENTROPY, 1e-9));
    }


    @Test
    public void reactionSymmetryNumberIsRatioOfReactantsAndProducts() throws Exception
    {
        assertThat(corrector.getReactionSymmetryNumber(reaction("CC", new String[] { "C", "C" }, 1.0)), is(2.0));
        assertThat(corrector.getReactionSymmetryNumber(reaction("C", new String[] { "[H][H]", "CC" }, 1.0)),
                is(0.25));
        assertThat(corrector.getReactionSymmetryNumber(reaction("[13CH3]C", new String[] { "[13CH4]", "C" }, 1.0)),
                is(1.0));
    }


    @Test
    public void labelledFactorsFollowSymmetryRatio() throws Exception
    {
        Reaction unlabelled = reaction("CC", new String[] { "C", "C" }, 1.0e6);
        Reaction labelled = reaction("[13CH3]C", new String[] { "[13CH4]", "C" }, 1.0e6);
        Reaction doubly = reaction("[13CH3][13CH3]", new String[] { "[13CH4]", "[13CH4]" }, 3.0e6);

        RateCorrectionReport report = corrector.correctRateFactors(Arrays.asList(labelled, unlabelled, doubly));

        assertThat(report.getClusterCount(), is(1));
        assertFalse(report.hasFailures());
        assertThat(unlabelled.getKinetics().getPreExponentialFactor(), is(1.0e6));
        assertThat(labelled.getKinetics().getPreExponentialFactor(), closeTo(5.0e5, 1e-6));
        assertThat(doubly.getKinetics().getPreExponentialFactor(), closeTo(1.0e6, 1e-6));

        assertThat(report.getCorrections(), hasSize(2));
        assertThat(report.getCorrections().get(0).reaction, is(sameInstance(labelled)));
        assertThat(report.getCorrections().get(0).reference, is(sameInstance(unlabelled)));
        assertThat(report.getCorrections().get(0).originalFactor, is(1.0e6));
        assertThat(report.getSynthesizedReferences(), is(empty()));
    }


    @Test
    public void factorsWithinToleranceAreKept() throws Exception
    {
        Reaction unlabelled = reaction("CC", new String[] { "C", "C" }, 1.0e6);
        Reaction labelled = reaction("[13CH3]C", new String[] { "[13CH4]", "C" }, 5.0e5 * (1 + 1e-7));

        RateCorrectionReport report = corrector.correctRateFactors(Arrays.asList(unlabelled, labelled));

        assertThat(report.getCorrections(), is(empty()));
        assertThat(labelled.getKinetics().getPreExponentialFactor(), is(5.0e5 * (1 + 1e-7)));
    }


    @Test
    public void strippedCopyServesAsMissingReference() throws Exception
    {
        Reaction labelled = reaction("[13CH3]C", new String[] { "[13CH4]", "C" }, 1.0e6);
        Reaction doubly = reaction("[13CH3][13CH3]", new String[] { "[13CH4]", "[13CH4]" }, 5.0e6);

        RateCorrectionReport report = corrector.correctRateFactors(Arrays.asList(labelled, doubly));

        assertThat(report.getSynthesizedReferences(), hasSize(1));
        assertFalse(IsotopomerComparator.isEnriched(report.getSynthesizedReferences().get(0)));
        assertThat(labelled.getKinetics().getPreExponentialFactor(), closeTo(5.0e5, 1e-6));
        assertThat(doubly.getKinetics().getPreExponentialFactor(), closeTo(1.0e6, 1e-6));
        assertTrue(IsotopomerComparator.isEnriched(labelled));
    }


    @Test
    public void identicalReactantsHalveFactorInEveryCluster() throws Exception
    {
        Reaction methane = bimolecular("C", "C", "CC", 1.0e6);
        Reaction labelledMethane = bimolecular("[13CH4]", "C", "[13CH3]C", 1.0e6);
        Reaction water = bimolecular("O", "O", "OO", 4.0e6);

        RateCorrectionReport report = corrector.correctRateFactors(Arrays.asList(methane, labelledMethane, water));

        assertThat(report.getClusterCount(), is(2));
        assertThat(report.getHalved(), contains(methane, water));
        assertThat(methane.getKinetics().getPreExponentialFactor(), closeTo(5.0e5, 1e-6));
        assertThat(labelledMethane.getKinetics().getPreExponentialFactor(), closeTo(2.0e6, 1e-6));
        assertThat(water.getKinetics().getPreExponentialFactor(), closeTo(2.0e6, 1e-6));
    }


    @Test
    public void oppositeDirectionKeepsItsFactor() throws Exception
    {
        Reaction unlabelled = reaction("CC", new String[] { "C", "C" }, 1.0e6);
        Reaction labelled = reaction("[13CH3]C", new String[] { "[13CH4]", "C" }, 1.0e6);
        Reaction recombination = bimolecular("[13CH4]", "C", "[13CH3]C", 1.0e8);

        RateCorrectionReport report = corrector.correctRateFactors(Arrays.asList(unlabelled, recombination,
                labelled));

        assertThat(report.getClusterCount(), is(1));
        assertFalse(report.hasFailures());
        assertThat(report.getReversed(), contains(recombination));
        assertThat(report.getHalved(), is(empty()));
        assertThat(recombination.getKinetics().getPreExponentialFactor(), is(1.0e8));
        assertThat(labelled.getKinetics().getPreExponentialFactor(), closeTo(5.0e5, 1e-6));
        assertThat(report.getCorrections(), hasSize(1));
        assertThat(report.getCorrections().get(0).reaction, is(sameInstance(labelled)));
    }


    @Test
    public void identicalReactantsWithEPKineticsAreHalved() throws Exception
    {
        Reaction reaction = reaction(new Species[] { species("A", "C"), species("A", "C") },
                new Species[] { species("P", "CC") }, new ArrheniusEP(8.0e5, 0.0, 0.5, 1.0e4));

        corrector.correctRateFactors(Arrays.asList(reaction));

        assertThat(reaction.getKinetics().getPreExponentialFactor(), closeTo(4.0e5, 1e-6));
    }


    @Test
    public void clusterWithoutFactorFailsAlone() throws Exception
    {
        Reaction chebyshev = reaction(new Species[] { species("A", "CO") }, new Species[] { species("B", "C"),
                species("C", "O") }, new Chebyshev(new double[][] { { 1.0 } }, 300.0, 2000.0, 0.01, 100.0));
        Reaction labelled = reaction("[13CH3]O", new String[] { "[13CH4]", "O" }, 7.0e6);
        Reaction unlabelled = reaction("CC", new String[] { "C", "C" }, 1.0e6);
        Reaction labelledEthane = reaction("[13CH3]C", new String[] { "[13CH4]", "C" }, 1.0e6);

        RateCorrectionReport report = corrector.correctRateFactors(Arrays.asList(chebyshev, labelled, unlabelled,
                labelledEthane));

        assertTrue(report.hasFailures());
        assertThat(report.getFailures(), hasSize(1));
        assertThat(report.getFailures().get(0).cluster, contains(chebyshev, labelled));
        assertThat(report.getFailures().get(0).cause, instanceOf(ConfigurationException.class));
        assertThat(labelled.getKinetics().getPreExponentialFactor(), is(7.0e6));
        assertThat(labelledEthane.getKinetics().getPreExponentialFactor(), closeTo(5.0e5, 1e-6));
    }


    @Test
    public void invalidSymmetryNumberIsReported() throws Exception
    {
        SymmetryNumberProvider broken = mock(SymmetryNumberProvider.class);
        when(broken.symmetryNumber(any(IAtomContainer.class))).thenReturn(0.0);

        SymmetryCorrector failing = new SymmetryCorrector(broken, comparator, stripper);
        Reaction unlabelled = reaction("CC", new String[] { "C", "C" }, 1.0e6);
        Reaction labelled = reaction("[13CH3]C", new String[] { "[13CH4]", "C" }, 2.0e6);

        assertThrows(NumericException.class,
                () -> failing.correctEntropy(species("ethane", "[13CH3]C"), species("ethane", "CC")));

        RateCorrectionReport report = failing.correctRateFactors(Arrays.asList(unlabelled, labelled));

        assertThat(report.getFailures(), hasSize(1));
        assertThat(report.getFailures().get(0).cause, instanceOf(NumericException.class));
        assertThat(unlabelled.getKinetics().getPreExponentialFactor(), is(1.0e6));
        assertThat(labelled.getKinetics().getPreExponentialFactor(), is(2.0e6));
    }
}
