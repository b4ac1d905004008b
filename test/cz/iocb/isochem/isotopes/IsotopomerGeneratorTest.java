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
import static cz.iocb.isochem.SpeciesFixtures.countLabelledAtoms;
import static cz.iocb.isochem.SpeciesFixtures.species;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import cz.iocb.isochem.model.Constants;
import cz.iocb.isochem.model.Species;
import cz.iocb.isochem.molecule.AutomorphismSymmetryNumber;
import cz.iocb.isochem.molecule.IsomorphismOracle;
import cz.iocb.isochem.molecule.ResonanceGenerator;
import cz.iocb.isochem.molecule.StructureIsomorphismOracle;



public class IsotopomerGeneratorTest
{
    private IsomorphismOracle oracle;
    private IsotopomerGenerator generator;


    @BeforeEach
    public void setUp()
    {
        oracle = new StructureIsomorphismOracle();

        IsotopeStripper stripper = new IsotopeStripper();
        IsotopomerComparator comparator = new IsotopomerComparator(oracle, stripper);
        SymmetryCorrector corrector = new SymmetryCorrector(new AutomorphismSymmetryNumber(), comparator, stripper);

        generator = new IsotopomerGenerator(oracle, corrector);
    }


    @Test
    public void singleCarbonGivesSingleIsotopomer() throws Exception
    {
        List<Species> isotopomers = generator.generate(species("methanol", "CO"), 1);

        assertThat(isotopomers, hasSize(1));
        assertThat(isotopomers.get(0).getMolecule().getAtom(0).getMassNumber(), is(13));
        assertThat(isotopomers.get(0).getMolecule().getAtom(1).getMassNumber(), nullValue());
        assertThat(isotopomers.get(0).getLabel(), is("methanol"));
    }


    @Test
    public void zeroLabelsGiveNothing() throws Exception
    {
        assertThat(generator.generate(species("propane", "CCC"), 0), is(empty()));
    }


    @Test
    public void speciesWithoutCarbonGivesNothing() throws Exception
    {
        assertThat(generator.generate(species("water", "O"), 3), is(empty()));
    }


    @Test
    public void negativeBoundIsRejected() throws Exception
    {
        Species propane = species("propane", "CCC");

        assertThrows(IllegalArgumentException.class, () -> generator.generate(propane, -1));
    }


    @Test
    public void equivalentPositionsAreMerged() throws Exception
    {
        Species propane = species("propane", "CCC");

        assertThat(generator.generate(propane, 1), hasSize(2));
        assertThat(generator.generate(propane, 2), hasSize(4));
        assertThat(generator.generate(propane, 3), hasSize(5));
        assertThat(generator.generate(propane, 10), hasSize(5));
        assertThat(generator.generate(species("ethane", "CC"), 2), hasSize(2));
    }


    @Test
    public void firstGeneratedRepresentativeIsKept() throws Exception
    {
        List<Species> isotopomers = generator.generate(species("propane", "CCC"), 1);

        assertThat(isotopomers.get(0).getMolecule().getAtom(0).getMassNumber(), is(13));
        assertThat(isotopomers.get(1).getMolecule().getAtom(1).getMassNumber(), is(13));
    }


    @Test
    public void isotopomersRespectBoundAndAreDistinct() throws Exception
    {
        Species reference = species("butanol", "CCCCO");
        List<Species> isotopomers = generator.generate(reference, 2);

        for(int i = 0; i < isotopomers.size(); i++)
        {
            int labelled = countLabelledAtoms(isotopomers.get(i).getMolecule());

            assertTrue(labelled >= 1);
            assertThat(labelled, lessThanOrEqualTo(2));
            assertTrue(oracle.isomorphic(isotopomers.get(i).getMolecule(), reference.getMolecule(), false));

            for(int j = i + 1; j < isotopomers.size(); j++)
                assertFalse(oracle.isomorphic(isotopomers.get(i).getMolecule(), isotopomers.get(j).getMolecule(),
                        true));
        }

        // 4 singly and 6 doubly labelled
        assertThat(isotopomers, hasSize(10));
    }


    @Test
    public void generationIsDeterministic() throws Exception
    {
        Species reference = species("isobutane", "CC(C)C");
        List<Species> first = generator.generate(reference, 2);
        List<Species> second = generator.generate(reference, 2);

        assertThat(second, hasSize(first.size()));

        for(int i = 0; i < first.size(); i++)
            assertTrue(oracle.isomorphic(first.get(i).getMolecule(), second.get(i).getMolecule(), true));
    }


    @Test
    public void referenceIsNotModified() throws Exception
    {
        Species reference = species("ethane", "CC");

        generator.generate(reference, 2);

        assertThat(countLabelledAtoms(reference.getMolecule()), is(0));
        assertThat(reference.getThermo().getEntropy(), is(ENTROPY));
    }


    @Test
    public void entropyIsCorrectedForLostSymmetry() throws Exception
    {
        Species reference = species("ethane", "CC");
        List<Species> isotopomers = generator.generate(reference, 2);

        Species single = isotopomers.get(0);
        Species both = isotopomers.get(1);

        assertThat(countLabelledAtoms(single.getMolecule()), is(1));
        assertThat(single.getThermo(), not(sameInstance(reference.getThermo())));
        assertThat(single.getThermo().getEntropy(), closeTo(ENTROPY + Constants.R * Math.log(2), 1e-9));

        assertThat(countLabelledAtoms(both.getMolecule()), is(2));
        assertThat(both.getThermo().getEntropy(), closeTo(ENTROPY, 1e-9));
    }


    @Test
    public void allReferencesAreExpanded() throws Exception
    {
        List<Species> isotopomers = generator.generateAll(
                Arrays.asList(species("ethane", "CC"), species("water", "O"), species("methanol", "CO")), 1);

        assertThat(isotopomers, hasSize(2));
        assertThat(isotopomers.get(0).getLabel(), is("ethane"));
        assertThat(isotopomers.get(1).getLabel(), is("methanol"));
    }


    @Test
    public void otherIsotopesCanBeGenerated() throws Exception
    {
        IsotopeStripper stripper = new IsotopeStripper();
        SymmetryCorrector corrector = new SymmetryCorrector(new AutomorphismSymmetryNumber(),
                new IsotopomerComparator(oracle, stripper), stripper);
        IsotopomerGenerator oxygen = new IsotopomerGenerator(oracle, corrector, ResonanceGenerator.NONE, "O", 18);

        List<Species> isotopomers = oxygen.generate(species("methanol", "CO"), 2);

        assertThat(isotopomers, hasSize(1));
        assertThat(isotopomers.get(0).getMolecule().getAtom(1).getMassNumber(), is(18));
    }


    @Test
    public void unknownIsotopeIsRejected()
    {
        IsotopeStripper stripper = new IsotopeStripper();
        SymmetryCorrector corrector = new SymmetryCorrector(new AutomorphismSymmetryNumber(),
                new IsotopomerComparator(oracle, stripper), stripper);

        assertThrows(IllegalArgumentException.class,
                () -> new IsotopomerGenerator(oracle, corrector, ResonanceGenerator.NONE, "C", 99));
    }


    @Test
    public void missingThermoIsReported() throws Exception
    {
        Species reference = species("ethane", "CC");
        reference.setThermo(null);

        assertThrows(ConfigurationException.class, () -> generator.generate(reference, 1));
    }
}
