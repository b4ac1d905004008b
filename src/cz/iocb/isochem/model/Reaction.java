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



/**
 * Reaction of a model. Reactants and products are shared references to the species of the model.
 */
public class Reaction
{
    private int index = -1;
    private String label = "";
    private List<Species> reactants;
    private List<Species> products;
    private Kinetics kinetics;
    private boolean reversible = true;


    public Reaction(List<Species> reactants, List<Species> products, Kinetics kinetics)
    {
        this.reactants = new ArrayList<Species>(reactants);
        this.products = new ArrayList<Species>(products);
        this.kinetics = kinetics;
    }


    /**
     * Copies the reaction. The species are shared with the original, the kinetics is copied.
     */
    public Reaction copy()
    {
        Reaction copy = new Reaction(reactants, products, kinetics != null ? kinetics.copy() : null);
        copy.index = index;
        copy.label = label;
        copy.reversible = reversible;
        return copy;
    }


    public int getIndex()
    {
        return index;
    }


    public void setIndex(int index)
    {
        this.index = index;
    }


    public String getLabel()
    {
        return label;
    }


    public void setLabel(String label)
    {
        this.label = label;
    }


    public List<Species> getReactants()
    {
        return Collections.unmodifiableList(reactants);
    }


    public void setReactants(List<Species> reactants)
    {
        this.reactants = new ArrayList<Species>(reactants);
    }


    public List<Species> getProducts()
    {
        return Collections.unmodifiableList(products);
    }


    public void setProducts(List<Species> products)
    {
        this.products = new ArrayList<Species>(products);
    }


    public Kinetics getKinetics()
    {
        return kinetics;
    }


    public boolean isReversible()
    {
        return reversible;
    }


    public void setReversible(boolean reversible)
    {
        this.reversible = reversible;
    }


    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder();

        for(int i = 0; i < reactants.size(); i++)
            builder.append(i > 0 ? " + " : "").append(reactants.get(i));

        builder.append(reversible ? " <=> " : " => ");

        for(int i = 0; i < products.size(); i++)
            builder.append(i > 0 ? " + " : "").append(products.get(i));

        return builder.toString();
    }
}
