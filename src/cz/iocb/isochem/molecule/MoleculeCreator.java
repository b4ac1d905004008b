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

import java.io.IOException;
import java.io.StringReader;
import java.util.LinkedList;
import java.util.List;
import org.openscience.cdk.aromaticity.Kekulization;
import org.openscience.cdk.atomtype.CDKAtomTypeMatcher;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.exception.InvalidSmilesException;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IAtomType;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.interfaces.IBond.Order;
import org.openscience.cdk.interfaces.IChemObjectBuilder;
import org.openscience.cdk.interfaces.IIsotope;
import org.openscience.cdk.interfaces.IPseudoAtom;
import org.openscience.cdk.io.DefaultChemObjectReader;
import org.openscience.cdk.io.MDLV2000Reader;
import org.openscience.cdk.io.MDLV3000Reader;
import org.openscience.cdk.silent.AtomContainer;
import org.openscience.cdk.silent.SilentChemObjectBuilder;
import org.openscience.cdk.smiles.SmilesParser;
import org.openscience.cdk.tools.CDKHydrogenAdder;
import org.openscience.cdk.tools.manipulator.AtomContainerManipulator;
import org.openscience.cdk.tools.manipulator.AtomTypeManipulator;



public class MoleculeCreator
{
    public static IAtomContainer translateMolecule(String mol) throws CDKException, IOException
    {
        return translateMolecule(mol, false);
    }


    /**
     * Reads a structure given either as a molfile (multi-line input) or as a SMILES string.
     */
    public static IAtomContainer translateMolecule(String mol, boolean explicitHydrogens)
            throws CDKException, IOException
    {
        IAtomContainer molecule = mol.contains("\n") ? getMoleculeFromMolfile(mol) : getMoleculeFromSmiles(mol);

        if(explicitHydrogens)
            AtomContainerManipulator.convertImplicitToExplicitHydrogens(molecule);

        return molecule;
    }


    public static IAtomContainer clone(IAtomContainer molecule) throws CDKException
    {
        try
        {
            return molecule.clone();
        }
        catch(CloneNotSupportedException e)
        {
            throw new CDKException("molecule cloning is not supported", e);
        }
    }


    private static IAtomContainer getMoleculeFromMolfile(String mol) throws CDKException, IOException
    {
        DefaultChemObjectReader mdlReader;

        if(mol.contains("M  V30 BEGIN CTAB"))
        {
            mdlReader = new MDLV3000Reader();
        }
        else
        {
            mdlReader = new MDLV2000Reader();
            mdlReader.getSetting("AddStereoElements").setSetting("false");
        }

        mdlReader.setReader(new StringReader(mol));
        IAtomContainer molecule;


        try
        {
            molecule = mdlReader.read(new AtomContainer());
        }
        catch(Exception e)
        {
            throw new CDKException("cannot parse molfile: " + e.getMessage(), e);
        }
        finally
        {
            mdlReader.close();
        }

        sanitizeMolecule(molecule);

        return molecule;
    }


    private static IAtomContainer getMoleculeFromSmiles(String smiles) throws CDKException
    {
        SmilesParser sp = new SmilesParser(SilentChemObjectBuilder.getInstance());
        IAtomContainer molecule;

        try
        {
            molecule = sp.parseSmiles(smiles);
        }
        catch(InvalidSmilesException e)
        {
            sp.kekulise(false);
            molecule = sp.parseSmiles(smiles);
        }

        sanitizeMolecule(molecule);

        molecule.setTitle(smiles);

        return molecule;
    }


    private static void sanitizeMolecule(IAtomContainer molecule) throws CDKException
    {
        IChemObjectBuilder builder = molecule.getBuilder();

        for(int i = 0; i < molecule.getAtomCount(); i++)
        {
            IAtom atom = molecule.getAtom(i);

            if(atom instanceof IPseudoAtom)
            {
                String symbol = ((IPseudoAtom) atom).getLabel();

                if(symbol.equals("D") || symbol.equals("T"))
                {
                    IIsotope isotope = builder.newInstance(IIsotope.class, "H", symbol.equals("D") ? 2 : 3);
                    IAtom hydrogen = builder.newInstance(IAtom.class, isotope);
                    hydrogen.setFormalCharge(atom.getFormalCharge());
                    hydrogen.setImplicitHydrogenCount(atom.getImplicitHydrogenCount());
                    hydrogen.setPoint3d(atom.getPoint3d());
                    hydrogen.setPoint2d(atom.getPoint2d());

                    molecule.setAtom(i, hydrogen);
                }
                else
                {
                    atom.setAtomicNumber(0);
                }
            }
        }


        CDKAtomTypeMatcher matcher = CDKAtomTypeMatcher.getInstance(builder);
        CDKHydrogenAdder adder = CDKHydrogenAdder.getInstance(builder);

        for(IAtom atom : molecule.atoms())
        {
            if(atom.getImplicitHydrogenCount() == null)
            {
                if(atom instanceof IPseudoAtom)
                {
                    atom.setImplicitHydrogenCount(0);
                    continue;
                }

                IAtomType type = matcher.findMatchingAtomType(molecule, atom);

                if(type == null)
                    throw new CDKException("unknown atom type of atom " + (molecule.indexOf(atom) + 1));

                AtomTypeManipulator.configure(atom, type);
                adder.addImplicitHydrogens(molecule, atom);
            }
        }

        kekulize(molecule);
    }


    private static void kekulize(IAtomContainer molecule)
    {
        List<IBond> unset = new LinkedList<IBond>();

        for(IBond bond : molecule.bonds())
            if(bond.getOrder() == Order.UNSET && bond.isAromatic())
                unset.add(bond);

        if(!unset.isEmpty())
        {
            try
            {
                Kekulization.kekulize(molecule);
            }
            catch(CDKException e)
            {
                for(IBond bond : unset)
                    bond.setOrder(Order.UNSET);
            }
        }
    }
}
