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



/**
 * Read-only graph view of a structure as used by the isomorphism matcher. Atoms and bonds are addressed by their
 * zero-based index.
 */
public abstract class Molecule
{
    public static abstract class AtomType
    {
        public static final byte PSEUDO = 0;
        public static final byte H = 1;
        public static final byte C = 6;
        public static final byte N = 7;
        public static final byte O = 8;
    }


    public static abstract class BondType
    {
        public static final byte NONE = 0;
        public static final byte SINGLE = 1;
        public static final byte DOUBLE = 2;
        public static final byte TRIPLE = 3;
        public static final byte QUADRUPLE = 4;
        public static final byte AROMATIC = 11;
        public static final byte ANY = 15;
    }


    public abstract int getAtomCount();

    public abstract int getBondCount();

    public abstract byte getAtomNumber(int atom);

    public abstract String getAtomLabel(int atom);

    /** Mass number of the atom, or 0 when the atom carries the default isotope of its element. */
    public abstract int getAtomMass(int atom);

    public abstract byte getAtomHydrogenCount(int atom);

    public abstract byte getAtomFormalCharge(int atom);

    public abstract byte getAtomRadicalCount(int atom);

    public abstract int getBond(int atom0, int atom1);

    public abstract byte getBondType(int bond);

    public abstract int getBondAtom(int bond, int atom);

    public abstract int[] getBondedAtoms(int atom);


    public final boolean isAtomPseudo(int atom)
    {
        return getAtomNumber(atom) == AtomType.PSEUDO;
    }
}
