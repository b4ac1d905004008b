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

import java.util.Arrays;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.interfaces.IBond.Order;
import org.openscience.cdk.interfaces.IPseudoAtom;



/**
 * Snapshot of an {@link IAtomContainer}. Later changes of the container (e.g. isotope relabelling) are not reflected,
 * so a new snapshot has to be taken after every modification.
 */
public class ContainerMolecule extends Molecule
{
    private final int atomCount;
    private final int bondCount;

    private final byte[] atomNumbers;
    private final String[] atomLabels;
    private final int[] atomMasses;
    private final byte[] atomHydrogens;
    private final byte[] atomCharges;
    private final byte[] atomRadicals;

    private final byte[] bondTypes;
    private final int[][] bondAtoms;

    private final int[][] bondedAtoms;
    private final int[][] bondedBonds;


    public ContainerMolecule(IAtomContainer molecule)
    {
        atomCount = molecule.getAtomCount();
        bondCount = molecule.getBondCount();

        atomNumbers = new byte[atomCount];
        atomLabels = new String[atomCount];
        atomMasses = new int[atomCount];
        atomHydrogens = new byte[atomCount];
        atomCharges = new byte[atomCount];
        atomRadicals = new byte[atomCount];

        for(int i = 0; i < atomCount; i++)
        {
            IAtom atom = molecule.getAtom(i);

            if(atom instanceof IPseudoAtom || atom.getAtomicNumber() == null || atom.getAtomicNumber() == 0)
            {
                atomNumbers[i] = AtomType.PSEUDO;
                atomLabels[i] = atom instanceof IPseudoAtom ? ((IPseudoAtom) atom).getLabel() : atom.getSymbol();
            }
            else
            {
                atomNumbers[i] = (byte) (int) atom.getAtomicNumber();
                atomMasses[i] = IsotopeTools.getMassNumber(atom);
            }

            if(atom.getImplicitHydrogenCount() != null)
                atomHydrogens[i] = (byte) (int) atom.getImplicitHydrogenCount();

            if(atom.getFormalCharge() != null)
                atomCharges[i] = (byte) (int) atom.getFormalCharge();

            atomRadicals[i] = (byte) molecule.getConnectedSingleElectronsCount(atom);
        }


        bondTypes = new byte[bondCount];
        bondAtoms = new int[bondCount][2];

        int[] degrees = new int[atomCount];

        for(int i = 0; i < bondCount; i++)
        {
            IBond bond = molecule.getBond(i);

            bondTypes[i] = getBondType(bond);
            bondAtoms[i][0] = molecule.indexOf(bond.getBegin());
            bondAtoms[i][1] = molecule.indexOf(bond.getEnd());

            degrees[bondAtoms[i][0]]++;
            degrees[bondAtoms[i][1]]++;
        }


        bondedAtoms = new int[atomCount][];
        bondedBonds = new int[atomCount][];

        for(int i = 0; i < atomCount; i++)
        {
            bondedAtoms[i] = new int[degrees[i]];
            bondedBonds[i] = new int[degrees[i]];
        }

        Arrays.fill(degrees, 0);

        for(int i = 0; i < bondCount; i++)
        {
            for(int j = 0; j < 2; j++)
            {
                int atom = bondAtoms[i][j];
                int other = bondAtoms[i][1 - j];

                bondedAtoms[atom][degrees[atom]] = other;
                bondedBonds[atom][degrees[atom]] = i;
                degrees[atom]++;
            }
        }
    }


    private static byte getBondType(IBond bond)
    {
        if(bond.isAromatic())
            return BondType.AROMATIC;

        Order order = bond.getOrder();

        if(order == null)
            return BondType.ANY;

        switch(order)
        {
            case SINGLE:
                return BondType.SINGLE;
            case DOUBLE:
                return BondType.DOUBLE;
            case TRIPLE:
                return BondType.TRIPLE;
            case QUADRUPLE:
                return BondType.QUADRUPLE;
            default:
                return BondType.ANY;
        }
    }


    @Override
    public int getAtomCount()
    {
        return atomCount;
    }


    @Override
    public int getBondCount()
    {
        return bondCount;
    }


    @Override
    public byte getAtomNumber(int atom)
    {
        return atomNumbers[atom];
    }


    @Override
    public String getAtomLabel(int atom)
    {
        return atomLabels[atom];
    }


    @Override
    public int getAtomMass(int atom)
    {
        return atomMasses[atom];
    }


    @Override
    public byte getAtomHydrogenCount(int atom)
    {
        return atomHydrogens[atom];
    }


    @Override
    public byte getAtomFormalCharge(int atom)
    {
        return atomCharges[atom];
    }


    @Override
    public byte getAtomRadicalCount(int atom)
    {
        return atomRadicals[atom];
    }


    @Override
    public int getBond(int atom0, int atom1)
    {
        int[] list = bondedAtoms[atom0];

        for(int i = 0; i < list.length; i++)
            if(list[i] == atom1)
                return bondedBonds[atom0][i];

        return -1;
    }


    @Override
    public byte getBondType(int bond)
    {
        return bondTypes[bond];
    }


    @Override
    public int getBondAtom(int bond, int atom)
    {
        return bondAtoms[bond][atom];
    }


    @Override
    public int[] getBondedAtoms(int atom)
    {
        return bondedAtoms[atom];
    }
}
