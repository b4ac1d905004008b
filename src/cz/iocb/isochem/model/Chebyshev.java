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
 * Pressure dependent Chebyshev rate law: log10 k(T, P) = sum c[t][p] phi_t(T') phi_p(P'), where T' and P' are the
 * reduced inverse temperature and reduced log pressure.
 */
public class Chebyshev extends Kinetics
{
    private final double[][] coefficients;
    private final double minPressure;
    private final double maxPressure;


    public Chebyshev(double[][] coefficients, double minTemperature, double maxTemperature, double minPressure,
            double maxPressure)
    {
        if(coefficients.length == 0 || coefficients[0].length == 0)
            throw new IllegalArgumentException("empty Chebyshev coefficient matrix");

        this.coefficients = new double[coefficients.length][];

        for(int i = 0; i < coefficients.length; i++)
        {
            if(coefficients[i].length != coefficients[0].length)
                throw new IllegalArgumentException("ragged Chebyshev coefficient matrix");

            this.coefficients[i] = coefficients[i].clone();
        }

        this.minPressure = minPressure;
        this.maxPressure = maxPressure;

        setTemperatureRange(minTemperature, maxTemperature);
    }


    @Override
    public double getRateCoefficient(double temperature, double pressure)
    {
        double tmin = getMinTemperature();
        double tmax = getMaxTemperature();

        double reducedTemperature = (2.0 / temperature - 1.0 / tmin - 1.0 / tmax) / (1.0 / tmax - 1.0 / tmin);
        double reducedPressure = (2.0 * Math.log10(pressure) - Math.log10(minPressure) - Math.log10(maxPressure))
                / (Math.log10(maxPressure) - Math.log10(minPressure));

        double logK = 0.0;

        for(int t = 0; t < coefficients.length; t++)
            for(int p = 0; p < coefficients[t].length; p++)
                logK += coefficients[t][p] * chebyshev(t, reducedTemperature) * chebyshev(p, reducedPressure);

        return Math.pow(10.0, logK);
    }


    private static double chebyshev(int n, double x)
    {
        if(n == 0)
            return 1.0;
        else if(n == 1)
            return x;

        double previous = 1.0;
        double current = x;

        for(int i = 2; i <= n; i++)
        {
            double next = 2.0 * x * current - previous;
            previous = current;
            current = next;
        }

        return current;
    }


    @Override
    public Chebyshev copy()
    {
        Chebyshev copy = new Chebyshev(coefficients, getMinTemperature(), getMaxTemperature(), minPressure,
                maxPressure);
        copyTo(copy);
        return copy;
    }


    @Override
    public String toString()
    {
        return "Chebyshev(" + coefficients.length + "x" + coefficients[0].length + ", T=" + getMinTemperature() + "-"
                + getMaxTemperature() + ", P=" + minPressure + "-" + maxPressure + ")";
    }
}
