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

import org.openscience.cdk.interfaces.IAtomContainer;



/**
 * Symmetry number taken as the number of label-preserving automorphisms of the structure graph. Hydrogens stored as
 * implicit counts do not contribute, so explicit hydrogens are needed for rotor symmetries such as the methyl group.
 */
public class AutomorphismSymmetryNumber implements SymmetryNumberProvider
{
    @Override
    public double symmetryNumber(IAtomContainer molecule)
    {
        Molecule graph = new ContainerMolecule(molecule);
        Isomorphism isomorphism = new Isomorphism(graph, IsotopeMode.DEFAULT_AS_STANDARD);

        return isomorphism.countMatches(graph, 0);
    }
}
