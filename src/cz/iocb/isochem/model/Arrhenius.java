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



/**
 * Modified Arrhenius rate law k(T) = A (T/T0)^n exp(-Ea/RT).
 */
public class Arrhenius extends Kinetics
{
    private double factor;
    private final double exponent;
    private final double activationEnergy;
    private final double referenceTemperature;


    public Arrhenius(double factor, double exponent, double activationEnergy)
    {
        this(factor, exponent, activationEnergy, 1.0);
    }


    public Arrhenius(double factor, double exponent, double activationEnergy, double referenceTemperature)
    {
        this.factor = factor;
        this.exponent = exponent;
        this.activationEnergy = activationEnergy;
        this.referenceTemperature = referenceTemperature;
    }


    @Override
    public boolean hasPreExponentialFactor()
    {
        return true;
    }


    @Override
    public double getPreExponentialFactor()
    {
        return factor;
    }


    @Override
    public void setPreExponentialFactor(double factor)
    {
        this.factor = factor;
    }


    public double getExponent()
    {
        return exponent;
    }


    public double getActivationEnergy()
    {
        return activationEnergy;
    }


    public double getReferenceTemperature()
    {
        return referenceTemperature;
    }


    @Override
    public double getRateCoefficient(double temperature, double pressure)
    {
        return factor * Math.pow(temperature / referenceTemperature, exponent)
                * Math.exp(-activationEnergy / (Constants.R * temperature));
    }


    @Override
    public Arrhenius copy()
    {
        Arrhenius copy = new Arrhenius(factor, exponent, activationEnergy, referenceTemperature);
        copyTo(copy);
        return copy;
    }


    @Override
    public String toString()
    {
        return "Arrhenius(A=" + factor + ", n=" + exponent + ", Ea=" + activationEnergy + ", T0="
                + referenceTemperature + ")";
    }
}
