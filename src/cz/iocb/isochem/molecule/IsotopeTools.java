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
import org.openscience.cdk.config.Elements;
import org.openscience.cdk.config.Isotopes;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IIsotope;



/**
 * Isotope bookkeeping on CDK atoms. An atom without a mass number carries the default (natural) isotope of its
 * element.
 */
public class IsotopeTools
{
    private static final Isotopes isotopes;


    static
    {
        try
        {
            isotopes = Isotopes.getInstance();
        }
        catch(IOException e)
        {
            throw new RuntimeException(e);
        }
    }


    public static boolean hasDefaultIsotope(IAtom atom)
    {
        return atom.getMassNumber() == null;
    }


    /**
     * Returns the mass number of the atom, or 0 if the atom carries the default isotope or explicitly the major isotope
     * of its element.
     */
    public static int getMassNumber(IAtom atom)
    {
        Integer massNumber = atom.getMassNumber();

        if(massNumber == null || massNumber == -1)
            return 0;

        Integer atomicNumber = atom.getAtomicNumber();

        if(atomicNumber == null || atomicNumber == 0)
            return 0;

        IIsotope majorIsotope = isotopes.getMajorIsotope(atomicNumber);

        if(majorIsotope != null && majorIsotope.getMassNumber().equals(massNumber))
            return 0;

        return massNumber;
    }


    public static boolean isEnriched(IAtom atom)
    {
        return getMassNumber(atom) != 0;
    }


    public static boolean isEnriched(IAtomContainer molecule)
    {
        for(IAtom atom : molecule.atoms())
            if(isEnriched(atom))
                return true;

        return false;
    }


    public static void setDefaultIsotope(IAtom atom)
    {
        atom.setMassNumber(null);
        atom.setExactMass(null);
        atom.setNaturalAbundance(null);
    }


    public static void setIsotope(IAtom atom, int massNumber)
    {
        IIsotope isotope = isotopes.getIsotope(atom.getSymbol(), massNumber);

        atom.setMassNumber(massNumber);
        atom.setExactMass(isotope != null ? isotope.getExactMass() : null);
        atom.setNaturalAbundance(isotope != null ? isotope.getNaturalAbundance() : null);
    }


    public static int getAtomicNumber(String symbol)
    {
        Elements element = Elements.ofString(symbol);

        if(element == Elements.Unknown)
            throw new IllegalArgumentException("unknown element symbol: " + symbol);

        return element.number();
    }


    public static boolean isKnownIsotope(String symbol, int massNumber)
    {
        return isotopes.getIsotope(symbol, massNumber) != null;
    }
}
