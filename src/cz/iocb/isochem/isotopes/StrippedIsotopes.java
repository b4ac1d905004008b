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

import java.util.ArrayList;
import java.util.List;
import org.openscience.cdk.interfaces.IAtom;
import cz.iocb.isochem.molecule.IsotopeTools;



/**
 * Restore token of an in-place isotope strip. Closing the token writes the original isotopes back; it has to be
 * closed before the stripped entity is observed by anyone else.
 */
public class StrippedIsotopes implements AutoCloseable
{
    private static class StrippedAtom
    {
        final IAtom atom;
        final Integer massNumber;
        final Double exactMass;
        final Double naturalAbundance;

        StrippedAtom(IAtom atom)
        {
            this.atom = atom;
            this.massNumber = atom.getMassNumber();
            this.exactMass = atom.getExactMass();
            this.naturalAbundance = atom.getNaturalAbundance();
        }
    }


    private final List<StrippedAtom> atoms = new ArrayList<StrippedAtom>();
    private boolean restored = false;


    void strip(IAtom atom)
    {
        atoms.add(new StrippedAtom(atom));
        IsotopeTools.setDefaultIsotope(atom);
    }


    public int size()
    {
        return atoms.size();
    }


    public boolean isEmpty()
    {
        return atoms.isEmpty();
    }


    public boolean isRestored()
    {
        return restored;
    }


    public void restore()
    {
        if(restored)
            return;

        for(int i = atoms.size() - 1; i >= 0; i--)
        {
            StrippedAtom stripped = atoms.get(i);

            stripped.atom.setMassNumber(stripped.massNumber);
            stripped.atom.setExactMass(stripped.exactMass);
            stripped.atom.setNaturalAbundance(stripped.naturalAbundance);
        }

        restored = true;
    }


    @Override
    public void close()
    {
        restore();
    }
}
