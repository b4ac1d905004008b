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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import cz.iocb.isochem.model.Species;
import cz.iocb.isochem.molecule.IsomorphismOracle;
import cz.iocb.isochem.molecule.IsotopeTools;
import cz.iocb.isochem.molecule.MoleculeCreator;
import cz.iocb.isochem.molecule.ResonanceGenerator;



/**
 * Generates the isotopomers of a species by relabelling up to a given number of atoms of one element with one
 * isotope (carbon-13 by default).
 */
public class IsotopomerGenerator
{
    public static final String DEFAULT_ELEMENT = "C";
    public static final int DEFAULT_MASS_NUMBER = 13;

    private static final Logger LOGGER = LoggerFactory.getLogger(IsotopomerGenerator.class);


    private static class Candidate
    {
        final IAtomContainer molecule;
        final int depth;

        Candidate(IAtomContainer molecule, int depth)
        {
            this.molecule = molecule;
            this.depth = depth;
        }
    }


    private final IsomorphismOracle oracle;
    private final SymmetryCorrector corrector;
    private final ResonanceGenerator resonanceGenerator;
    private final String element;
    private final int atomicNumber;
    private final int massNumber;


    public IsotopomerGenerator(IsomorphismOracle oracle, SymmetryCorrector corrector)
    {
        this(oracle, corrector, ResonanceGenerator.NONE, DEFAULT_ELEMENT, DEFAULT_MASS_NUMBER);
    }


    public IsotopomerGenerator(IsomorphismOracle oracle, SymmetryCorrector corrector,
            ResonanceGenerator resonanceGenerator, String element, int massNumber)
    {
        if(!IsotopeTools.isKnownIsotope(element, massNumber))
            throw new IllegalArgumentException("unknown isotope " + massNumber + element);

        this.oracle = oracle;
        this.corrector = corrector;
        this.resonanceGenerator = resonanceGenerator;
        this.element = element;
        this.atomicNumber = IsotopeTools.getAtomicNumber(element);
        this.massNumber = massNumber;
    }


    /**
     * Returns the distinct isotopomers of the species carrying between 1 and maxLabels labelled atoms. The entropy of
     * every isotopomer is corrected against the reference species.
     */
    public List<Species> generate(Species reference, int maxLabels) throws CDKException
    {
        if(maxLabels < 0)
            throw new IllegalArgumentException("negative maximum number of isotopic atoms: " + maxLabels);

        List<IAtomContainer> molecules = enumerate(reference.getMolecule(), maxLabels);

        List<Species> pool = new ArrayList<Species>(molecules.size());

        for(IAtomContainer molecule : molecules)
        {
            Species isotopomer = new Species(reference.getLabel(), resonanceGenerator.generate(molecule),
                    reference.getThermo());
            isotopomer.setReactive(reference.isReactive());
            pool.add(isotopomer);
        }


        List<Species> filtered = new ArrayList<Species>();

        for(Species candidate : pool)
        {
            boolean unique = true;

            for(Species isotopomer : filtered)
            {
                if(oracle.isomorphic(isotopomer.getMolecule(), candidate.getMolecule(), true))
                {
                    unique = false;
                    break;
                }
            }

            if(unique)
                filtered.add(candidate);
        }


        for(Species isotopomer : filtered)
            corrector.correctEntropy(isotopomer, reference);

        LOGGER.debug("{} distinct isotopomers of {} out of {} generated", filtered.size(), reference, pool.size());

        return filtered;
    }


    public List<Species> generateAll(List<Species> references, int maxLabels) throws CDKException
    {
        List<Species> isotopomers = new ArrayList<Species>();

        for(Species reference : references)
            isotopomers.addAll(generate(reference, maxLabels));

        return isotopomers;
    }


    /*
     * Depth-first enumeration with an explicit stack. Every relabelled structure is emitted before the structures
     * derived from it, in the order of the relabelled atoms.
     */
    private List<IAtomContainer> enumerate(IAtomContainer molecule, int maxLabels) throws CDKException
    {
        List<IAtomContainer> molecules = new ArrayList<IAtomContainer>();

        Deque<Candidate> stack = new ArrayDeque<Candidate>();
        stack.push(new Candidate(molecule, 0));

        while(!stack.isEmpty())
        {
            Candidate candidate = stack.pop();

            if(candidate.depth > 0)
                molecules.add(candidate.molecule);

            if(candidate.depth == maxLabels)
                continue;

            List<Candidate> derived = new ArrayList<Candidate>();

            for(int i = 0; i < candidate.molecule.getAtomCount(); i++)
            {
                IAtom atom = candidate.molecule.getAtom(i);

                if(atom.getAtomicNumber() == null || atom.getAtomicNumber() != atomicNumber)
                    continue;

                if(atom.getMassNumber() != null && atom.getMassNumber() == massNumber)
                    continue;

                IAtomContainer isotopomer = MoleculeCreator.clone(candidate.molecule);
                IsotopeTools.setIsotope(isotopomer.getAtom(i), massNumber);

                derived.add(new Candidate(isotopomer, candidate.depth + 1));
            }

            for(int i = derived.size() - 1; i >= 0; i--)
                stack.push(derived.get(i));
        }

        return molecules;
    }


    public String getElement()
    {
        return element;
    }


    public int getMassNumber()
    {
        return massNumber;
    }
}
