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
 * Arrhenius rate law with an Evans-Polanyi activation energy Ea = E0 + alpha * dHrxn.
 */
public class ArrheniusEP extends Kinetics
{
    private double factor;
    private final double exponent;
    private final double alpha;
    private final double intrinsicBarrier;


    public ArrheniusEP(double factor, double exponent, double alpha, double intrinsicBarrier)
    {
        this.factor = factor;
        this.exponent = exponent;
        this.alpha = alpha;
        this.intrinsicBarrier = intrinsicBarrier;
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


    public double getAlpha()
    {
        return alpha;
    }


    public double getIntrinsicBarrier()
    {
        return intrinsicBarrier;
    }


    public double getActivationEnergy(double reactionEnthalpy)
    {
        if(intrinsicBarrier > 0)
        {
            if(reactionEnthalpy < -4.0 * intrinsicBarrier)
                return 0.0;
            else if(reactionEnthalpy > 4.0 * intrinsicBarrier)
                return reactionEnthalpy;
        }

        return intrinsicBarrier + alpha * reactionEnthalpy;
    }


    public double getRateCoefficient(double temperature, double pressure, double reactionEnthalpy)
    {
        return factor * Math.pow(temperature, exponent)
                * Math.exp(-getActivationEnergy(reactionEnthalpy) / (Constants.R * temperature));
    }


    /** Rate coefficient of a thermoneutral reaction. */
    @Override
    public double getRateCoefficient(double temperature, double pressure)
    {
        return getRateCoefficient(temperature, pressure, 0.0);
    }


    @Override
    public ArrheniusEP copy()
    {
        ArrheniusEP copy = new ArrheniusEP(factor, exponent, alpha, intrinsicBarrier);
        copyTo(copy);
        return copy;
    }


    @Override
    public String toString()
    {
        return "ArrheniusEP(A=" + factor + ", n=" + exponent + ", alpha=" + alpha + ", E0=" + intrinsicBarrier + ")";
    }
}
