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
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.isochem.model.Reaction;
import cz.iocb.isochem.model.Species;
import cz.iocb.isochem.molecule.IsotopeTools;
import cz.iocb.isochem.molecule.ResonanceGenerator;



/**
 * Replaces the isotope labels of species and reactions by the default isotopes of the elements.
 */
public class IsotopeStripper
{
    private final ResonanceGenerator resonanceGenerator;


    public IsotopeStripper()
    {
        this(ResonanceGenerator.NONE);
    }


    public IsotopeStripper(ResonanceGenerator resonanceGenerator)
    {
        this.resonanceGenerator = resonanceGenerator;
    }


    /**
     * Returns a stripped copy of the species. Only the primary structure is stripped; the resonance forms are
     * regenerated from it.
     */
    public Species strip(Species species) throws CDKException
    {
        Species stripped = species.copy();
        IAtomContainer molecule = stripped.getMolecule();

        for(IAtom atom : molecule.atoms())
            if(!IsotopeTools.hasDefaultIsotope(atom))
                IsotopeTools.setDefaultIsotope(atom);

        stripped.setMolecules(resonanceGenerator.generate(molecule));

        return stripped;
    }


    /**
     * Returns a copy of the reaction whose reactants and products are stripped copies of the original species.
     */
    public Reaction strip(Reaction reaction) throws CDKException
    {
        Reaction stripped = reaction.copy();

        List<Species> reactants = new ArrayList<Species>(reaction.getReactants().size());

        for(Species reactant : reaction.getReactants())
            reactants.add(strip(reactant));

        List<Species> products = new ArrayList<Species>(reaction.getProducts().size());

        for(Species product : reaction.getProducts())
            products.add(strip(product));

        stripped.setReactants(reactants);
        stripped.setProducts(products);

        return stripped;
    }


    /**
     * Strips the labels of all structures of a species, or of all reactants and products of a reaction, in place.
     * The returned token must be closed to restore the labels.
     *
     * @throws IllegalArgumentException if the entity is neither a species nor a reaction; nothing is modified then
     */
    public StrippedIsotopes stripInPlace(Object entity)
    {
        StrippedIsotopes token = new StrippedIsotopes();

        if(entity instanceof Species)
        {
            stripInPlace((Species) entity, token);
        }
        else if(entity instanceof Reaction)
        {
            Reaction reaction = (Reaction) entity;

            for(Species reactant : reaction.getReactants())
                stripInPlace(reactant, token);

            for(Species product : reaction.getProducts())
                stripInPlace(product, token);
        }
        else
        {
            throw new IllegalArgumentException("only Reaction and Species objects are supported, "
                    + (entity == null ? "null" : entity.getClass().getName()) + " was sent");
        }

        return token;
    }


    private static void stripInPlace(Species species, StrippedIsotopes token)
    {
        for(IAtomContainer molecule : species.getMolecules())
            for(IAtom atom : molecule.atoms())
                if(!IsotopeTools.hasDefaultIsotope(atom))
                    token.strip(atom);
    }


    public static void restore(StrippedIsotopes token)
    {
        token.restore();
    }
}
