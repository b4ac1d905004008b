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
package cz.iocb.isochem.molecule;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.interfaces.IAtomContainer;



public class MoleculeCreatorTest
{
    private static final String ETHANOL_MOLFILE = "ethanol\n"
            + "  test\n"
            + "\n"
            + "  3  2  0  0  0  0  0  0  0  0999 V2000\n"
            + "    0.0000    0.0000    0.0000 C   0  0  0  0  0  0  0  0  0  0  0  0\n"
            + "    1.2990    0.7500    0.0000 C   0  0  0  0  0  0  0  0  0  0  0  0\n"
            + "    2.5981    0.0000    0.0000 O   0  0  0  0  0  0  0  0  0  0  0  0\n"
            + "  1  2  1  0  0  0  0\n"
            + "  2  3  1  0  0  0  0\n"
            + "M  ISO  1   1  13\n"
            + "M  END\n";


    @Test
    public void smilesIsotopesAreKept() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.translateMolecule("[13CH3]C");

        assertThat(molecule.getAtom(0).getMassNumber(), is(13));
        assertThat(molecule.getAtom(1).getMassNumber(), nullValue());
        assertThat(molecule.getAtom(1).getImplicitHydrogenCount(), is(3));
    }


    @Test
    public void molfileIsRead() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.translateMolecule(ETHANOL_MOLFILE);

        assertThat(molecule.getAtomCount(), is(3));
        assertThat(molecule.getBondCount(), is(2));
        assertThat(molecule.getAtom(0).getMassNumber(), is(13));
        assertThat(molecule.getAtom(2).getImplicitHydrogenCount(), is(1));
        assertTrue(IsotopeTools.isEnriched(molecule));
    }


    @Test
    public void cloneIsIndependent() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.translateMolecule("CC");
        IAtomContainer clone = MoleculeCreator.clone(molecule);

        assertThat(clone, not(sameInstance(molecule)));

        IsotopeTools.setIsotope(clone.getAtom(0), 13);

        assertTrue(IsotopeTools.isEnriched(clone));
        assertFalse(IsotopeTools.isEnriched(molecule));
    }


    @Test
    public void invalidSmilesIsRejected()
    {
        assertThrows(CDKException.class, () -> MoleculeCreator.translateMolecule("C1CC"));
    }
}
