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
package cz.iocb.isochem.workflow;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import cz.iocb.isochem.isotopes.ConfigurationException;



/**
 * Settings of an isotope job, read from the "isochem.isotopes" section of a Typesafe config.
 */
public class IsotopeSettings
{
    public static final String PATH = "isochem.isotopes";

    private final int maximumIsotopicAtoms;
    private final String element;
    private final int massNumber;
    private final double rateRelativeTolerance;
    private final double rateAbsoluteTolerance;
    private final boolean checkReverseReactions;


    public IsotopeSettings(int maximumIsotopicAtoms, String element, int massNumber, double rateRelativeTolerance,
            double rateAbsoluteTolerance, boolean checkReverseReactions)
    {
        this.maximumIsotopicAtoms = maximumIsotopicAtoms;
        this.element = element;
        this.massNumber = massNumber;
        this.rateRelativeTolerance = rateRelativeTolerance;
        this.rateAbsoluteTolerance = rateAbsoluteTolerance;
        this.checkReverseReactions = checkReverseReactions;
    }


    public static IsotopeSettings load() throws ConfigurationException
    {
        return from(ConfigFactory.load());
    }


    public static IsotopeSettings from(Config config) throws ConfigurationException
    {
        try
        {
            Config section = config.withFallback(ConfigFactory.defaultReference()).getConfig(PATH);

            if(!section.hasPath("maximum-isotopic-atoms"))
                throw new ConfigurationException("could not find the " + PATH + ".maximum-isotopic-atoms setting");

            int maximumIsotopicAtoms = section.getInt("maximum-isotopic-atoms");

            if(maximumIsotopicAtoms < 0)
                throw new ConfigurationException(PATH + ".maximum-isotopic-atoms must not be negative");

            return new IsotopeSettings(maximumIsotopicAtoms, section.getString("element"),
                    section.getInt("mass-number"), section.getDouble("rate-relative-tolerance"),
                    section.getDouble("rate-absolute-tolerance"), section.getBoolean("check-reverse-reactions"));
        }
        catch(ConfigException e)
        {
            throw new ConfigurationException("invalid isotope settings: " + e.getMessage(), e);
        }
    }


    public int getMaximumIsotopicAtoms()
    {
        return maximumIsotopicAtoms;
    }


    public String getElement()
    {
        return element;
    }


    public int getMassNumber()
    {
        return massNumber;
    }


    public double getRateRelativeTolerance()
    {
        return rateRelativeTolerance;
    }


    public double getRateAbsoluteTolerance()
    {
        return rateAbsoluteTolerance;
    }


    public boolean isCheckReverseReactions()
    {
        return checkReverseReactions;
    }


    @Override
    public String toString()
    {
        return PATH + "(maximum-isotopic-atoms=" + maximumIsotopicAtoms + ", isotope=" + massNumber + element + ")";
    }
}
