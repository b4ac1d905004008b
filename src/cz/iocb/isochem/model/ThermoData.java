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

import java.util.Arrays;



/**
 * Thermodynamic record of a species in SI units: enthalpy in J/mol, entropy and heat capacities in J/(mol K),
 * temperatures in K.
 */
public class ThermoData
{
    private double enthalpy;
    private double entropy;
    private double[] temperatures;
    private double[] heatCapacities;
    private double heatCapacity0 = Double.NaN;
    private double heatCapacityInf = Double.NaN;


    public ThermoData(double enthalpy, double entropy)
    {
        this(enthalpy, entropy, new double[0], new double[0]);
    }


    public ThermoData(double enthalpy, double entropy, double[] temperatures, double[] heatCapacities)
    {
        if(temperatures.length != heatCapacities.length)
            throw new IllegalArgumentException("heat capacity data do not match the temperature points");

        this.enthalpy = enthalpy;
        this.entropy = entropy;
        this.temperatures = temperatures.clone();
        this.heatCapacities = heatCapacities.clone();
    }


    public ThermoData copy()
    {
        ThermoData copy = new ThermoData(enthalpy, entropy, temperatures, heatCapacities);
        copy.heatCapacity0 = heatCapacity0;
        copy.heatCapacityInf = heatCapacityInf;
        return copy;
    }


    public double getEnthalpy()
    {
        return enthalpy;
    }


    public void setEnthalpy(double enthalpy)
    {
        this.enthalpy = enthalpy;
    }


    /** Standard entropy at 298 K. */
    public double getEntropy()
    {
        return entropy;
    }


    public void setEntropy(double entropy)
    {
        this.entropy = entropy;
    }


    public double[] getTemperatures()
    {
        return temperatures.clone();
    }


    public double[] getHeatCapacities()
    {
        return heatCapacities.clone();
    }


    public double getHeatCapacity0()
    {
        return heatCapacity0;
    }


    public void setHeatCapacity0(double heatCapacity0)
    {
        this.heatCapacity0 = heatCapacity0;
    }


    public double getHeatCapacityInf()
    {
        return heatCapacityInf;
    }


    public void setHeatCapacityInf(double heatCapacityInf)
    {
        this.heatCapacityInf = heatCapacityInf;
    }


    @Override
    public String toString()
    {
        return "ThermoData(H298=" + enthalpy + ", S298=" + entropy + ", Tdata=" + Arrays.toString(temperatures)
                + ", Cpdata=" + Arrays.toString(heatCapacities) + ")";
    }
}
