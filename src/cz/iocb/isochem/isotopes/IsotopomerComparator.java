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

import java.util.List;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.isochem.model.Reaction;
import cz.iocb.isochem.model.Species;
import cz.iocb.isochem.molecule.IsomorphismOracle;
import cz.iocb.isochem.molecule.IsotopeTools;



/**
 * Isomorphism of species and reactions on top of a structure isomorphism oracle.
 */
public class IsotopomerComparator
{
    private final IsomorphismOracle oracle;
    private final IsotopeStripper stripper;
    private final boolean checkReverse;


    public IsotopomerComparator(IsomorphismOracle oracle, IsotopeStripper stripper)
    {
        this(oracle, stripper, true);
    }


    /**
     * @param checkReverse whether a reaction also matches another reaction written in the reverse direction
     */
    public IsotopomerComparator(IsomorphismOracle oracle, IsotopeStripper stripper, boolean checkReverse)
    {
        this.oracle = oracle;
        this.stripper = stripper;
        this.checkReverse = checkReverse;
    }


    /**
     * Tests whether two species or two reactions differ only in their isotope labelling. Both entities are stripped
     * in place for the comparison and restored on every exit path.
     */
    public boolean sameIsotopomerFamily(Object entity, Object other)
    {
        checkEntity(entity);
        checkEntity(other);

        if(entity.getClass() != other.getClass())
            return false;

        try(StrippedIsotopes stripped = stripper.stripInPlace(entity);
                StrippedIsotopes otherStripped = stripper.stripInPlace(other))
        {
            return isIsomorphic(entity, other, true);
        }
    }


    public boolean isIsomorphic(Object entity, Object other, boolean labelSensitive)
    {
        checkEntity(entity);
        checkEntity(other);

        if(entity instanceof Species && other instanceof Species)
            return isIsomorphic((Species) entity, (Species) other, labelSensitive);
        else if(entity instanceof Reaction && other instanceof Reaction)
            return isIsomorphic((Reaction) entity, (Reaction) other, labelSensitive);
        else
            return false;
    }


    /**
     * Species are isomorphic if the primary structure of the first one is isomorphic to any structure of the other.
     */
    public boolean isIsomorphic(Species species, Species other, boolean labelSensitive)
    {
        if(species == other)
            return true;

        IAtomContainer molecule = species.getMolecule();

        for(IAtomContainer otherMolecule : other.getMolecules())
            if(oracle.isomorphic(molecule, otherMolecule, labelSensitive))
                return true;

        return false;
    }


    public boolean isIsomorphic(Reaction reaction, Reaction other, boolean labelSensitive)
    {
        if(isIsomorphicForward(reaction, other, labelSensitive))
            return true;

        if(!checkReverse)
            return false;

        return matches(reaction.getReactants(), other.getProducts(), labelSensitive)
                && matches(reaction.getProducts(), other.getReactants(), labelSensitive);
    }


    /**
     * Reactions are isomorphic in the written direction, i.e. reactants match reactants and products match products.
     */
    public boolean isIsomorphicForward(Reaction reaction, Reaction other, boolean labelSensitive)
    {
        return matches(reaction.getReactants(), other.getReactants(), labelSensitive)
                && matches(reaction.getProducts(), other.getProducts(), labelSensitive);
    }


    private boolean matches(List<Species> list, List<Species> other, boolean labelSensitive)
    {
        if(list.size() != other.size())
            return false;

        return matches(list, other, new boolean[other.size()], 0, labelSensitive);
    }


    private boolean matches(List<Species> list, List<Species> other, boolean[] used, int idx, boolean labelSensitive)
    {
        if(idx == list.size())
            return true;

        for(int i = 0; i < other.size(); i++)
        {
            if(used[i] || !isIsomorphic(list.get(idx), other.get(i), labelSensitive))
                continue;

            used[i] = true;

            if(matches(list, other, used, idx + 1, labelSensitive))
                return true;

            used[i] = false;
        }

        return false;
    }


    /**
     * Returns true if the species or any reactant or product of the reaction carries an enriched isotope.
     */
    public static boolean isEnriched(Object entity)
    {
        checkEntity(entity);

        if(entity instanceof Species)
            return IsotopeTools.isEnriched(((Species) entity).getMolecule());

        Reaction reaction = (Reaction) entity;

        for(Species reactant : reaction.getReactants())
            if(isEnriched(reactant))
                return true;

        for(Species product : reaction.getProducts())
            if(isEnriched(product))
                return true;

        return false;
    }


    static void checkEntity(Object entity)
    {
        if(!(entity instanceof Species) && !(entity instanceof Reaction))
            throw new IllegalArgumentException("only Reaction and Species objects are supported, "
                    + (entity == null ? "null" : entity.getClass().getName()) + " was sent");
    }
}
