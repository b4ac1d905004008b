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
package cz.iocb.isochem.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.isochem.molecule.MoleculeCreator;
import cz.iocb.isochem.molecule.SymmetryNumberProvider;



/**
 * Chemical species of a reaction model. The first structure is the primary one; the others are its resonance forms.
 * A species owns its structures, so every copy gets its own clones.
 */
public class Species
{
    private final String label;
    private int index = -1;
    private List<IAtomContainer> molecules;
    private ThermoData thermo;
    private boolean reactive = true;


    public Species(String label, IAtomContainer molecule, ThermoData thermo)
    {
        this(label, Collections.singletonList(molecule), thermo);
    }


    public Species(String label, List<IAtomContainer> molecules, ThermoData thermo)
    {
        this.label = label;
        this.thermo = thermo;
        setMolecules(molecules);
    }


    public Species copy() throws CDKException
    {
        List<IAtomContainer> clones = new ArrayList<IAtomContainer>(molecules.size());

        for(IAtomContainer molecule : molecules)
            clones.add(MoleculeCreator.clone(molecule));

        Species copy = new Species(label, clones, thermo != null ? thermo.copy() : null);
        copy.index = index;
        copy.reactive = reactive;
        return copy;
    }


    public String getLabel()
    {
        return label;
    }


    public int getIndex()
    {
        return index;
    }


    public void setIndex(int index)
    {
        this.index = index;
    }


    /**
     * Returns the label as written by the simulator into its profile headers, i.e. "label(index)" once the index is
     * assigned.
     */
    public String getIndexedLabel()
    {
        return index >= 0 ? label + "(" + index + ")" : label;
    }


    public IAtomContainer getMolecule()
    {
        return molecules.get(0);
    }


    public List<IAtomContainer> getMolecules()
    {
        return Collections.unmodifiableList(molecules);
    }


    public void setMolecules(List<IAtomContainer> molecules)
    {
        if(molecules.isEmpty())
            throw new IllegalArgumentException("species " + label + " has no structure");

        this.molecules = new ArrayList<IAtomContainer>(molecules);
    }


    public ThermoData getThermo()
    {
        return thermo;
    }


    public void setThermo(ThermoData thermo)
    {
        this.thermo = thermo;
    }


    public boolean isReactive()
    {
        return reactive;
    }


    public void setReactive(boolean reactive)
    {
        this.reactive = reactive;
    }


    public double getSymmetryNumber(SymmetryNumberProvider provider)
    {
        return provider.symmetryNumber(getMolecule());
    }


    @Override
    public String toString()
    {
        return getIndexedLabel();
    }
}
