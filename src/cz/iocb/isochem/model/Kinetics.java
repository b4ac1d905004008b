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
 * Rate law of a reaction. Only some rate laws are scaled by a pre-exponential factor; the others report so through
 * {@link #hasPreExponentialFactor()}.
 */
public abstract class Kinetics
{
    private double minTemperature = 0.0;
    private double maxTemperature = Double.POSITIVE_INFINITY;


    public boolean hasPreExponentialFactor()
    {
        return false;
    }


    public double getPreExponentialFactor()
    {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no pre-exponential factor");
    }


    public void setPreExponentialFactor(double factor)
    {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no pre-exponential factor");
    }


    public abstract double getRateCoefficient(double temperature, double pressure);

    public abstract Kinetics copy();


    protected void copyTo(Kinetics other)
    {
        other.minTemperature = minTemperature;
        other.maxTemperature = maxTemperature;
    }


    public double getMinTemperature()
    {
        return minTemperature;
    }


    public double getMaxTemperature()
    {
        return maxTemperature;
    }


    protected void setTemperatureRange(double minTemperature, double maxTemperature)
    {
        if(minTemperature > maxTemperature)
            throw new IllegalArgumentException("invalid temperature range");

        this.minTemperature = minTemperature;
        this.maxTemperature = maxTemperature;
    }
}
