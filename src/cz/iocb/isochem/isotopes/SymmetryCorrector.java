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

import java.util.List;
import org.openscience.cdk.exception.CDKException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import cz.iocb.isochem.model.Arrhenius;
import cz.iocb.isochem.model.ArrheniusEP;
import cz.iocb.isochem.model.Constants;
import cz.iocb.isochem.model.Kinetics;
import cz.iocb.isochem.model.Reaction;
import cz.iocb.isochem.model.Species;
import cz.iocb.isochem.model.ThermoData;
import cz.iocb.isochem.molecule.SymmetryNumberProvider;



/**
 * Keeps the entropies and the pre-exponential factors of isotopomers consistent with the unlabelled species and
 * reactions by means of symmetry numbers.
 */
public class SymmetryCorrector
{
    public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-5;
    public static final double DEFAULT_ABSOLUTE_TOLERANCE = 1e-8;

    private static final Logger LOGGER = LoggerFactory.getLogger(SymmetryCorrector.class);

    private final SymmetryNumberProvider symmetry;
    private final IsotopomerComparator comparator;
    private final IsotopeStripper stripper;
    private final double relativeTolerance;
    private final double absoluteTolerance;


    public SymmetryCorrector(SymmetryNumberProvider symmetry, IsotopomerComparator comparator,
            IsotopeStripper stripper)
    {
        this(symmetry, comparator, stripper, DEFAULT_RELATIVE_TOLERANCE, DEFAULT_ABSOLUTE_TOLERANCE);
    }


    public SymmetryCorrector(SymmetryNumberProvider symmetry, IsotopomerComparator comparator,
            IsotopeStripper stripper, double relativeTolerance, double absoluteTolerance)
    {
        this.symmetry = symmetry;
        this.comparator = comparator;
        this.stripper = stripper;
        this.relativeTolerance = relativeTolerance;
        this.absoluteTolerance = absoluteTolerance;
    }


    /**
     * Corrects the standard entropy of an isotopomer for the change of its symmetry number:
     * S(isotopomer) += R ln(sigma(reference)) - R ln(sigma(isotopomer)).
     *
     * The isotopomer gets a corrected copy of its thermo record, so a record shared with the reference is left intact.
     * Must be applied exactly once per isotopomer.
     */
    public void correctEntropy(Species isotopomer, Species reference) throws IsotopeException
    {
        ThermoData thermo = isotopomer.getThermo();

        if(thermo == null)
            throw new ConfigurationException("species " + isotopomer + " has no thermo data");

        double referenceSymmetry = getSymmetryNumber(reference);
        double isotopomerSymmetry = getSymmetryNumber(isotopomer);

        double correction = Constants.R * Math.log(referenceSymmetry) - Constants.R * Math.log(isotopomerSymmetry);

        ThermoData corrected = thermo.copy();
        corrected.setEntropy(thermo.getEntropy() + correction);
        isotopomer.setThermo(corrected);

        LOGGER.debug("entropy of {} corrected by {} J/(mol K)", isotopomer, correction);
    }


    public double getSymmetryNumber(Species species) throws NumericException
    {
        double value = species.getSymmetryNumber(symmetry);

        if(!(value > 0.0) || Double.isInfinite(value))
            throw new NumericException("invalid symmetry number " + value + " of species " + species);

        return value;
    }


    /**
     * Returns the reaction symmetry number, i.e. the product of the reactant symmetry numbers divided by the product
     * of the product symmetry numbers.
     */
    public double getReactionSymmetryNumber(Reaction reaction) throws NumericException
    {
        double reactantSymmetry = 1.0;

        for(Species reactant : reaction.getReactants())
            reactantSymmetry *= getSymmetryNumber(reactant);

        double productSymmetry = 1.0;

        for(Species product : reaction.getProducts())
            productSymmetry *= getSymmetryNumber(product);

        return reactantSymmetry / productSymmetry;
    }


    /**
     * Corrects the pre-exponential factors of the reactions in place so that the factors of reactions differing only
     * in isotope labelling are in the ratio of their reaction symmetry numbers. A failure affects only the cluster of
     * the failing reaction; it is logged and recorded in the report.
     */
    public RateCorrectionReport correctRateFactors(List<Reaction> reactions) throws CDKException
    {
        List<List<Reaction>> clusters = new IsotopomerClusterer(comparator).cluster(reactions);
        RateCorrectionReport report = new RateCorrectionReport();
        report.setClusterCount(clusters.size());

        for(List<Reaction> cluster : clusters)
        {
            try
            {
                correctRateFactorsOfIsotopomers(cluster, report);
            }
            catch(IsotopeException e)
            {
                LOGGER.error("pre-exponential factors of the reaction cluster of {} were not corrected: {}",
                        cluster.get(0), e.getMessage());
                report.addFailure(cluster, e);
            }
        }

        return report;
    }


    private void correctRateFactorsOfIsotopomers(List<Reaction> cluster, RateCorrectionReport report)
            throws CDKException
    {
        Reaction reference = null;

        for(Reaction reaction : cluster)
        {
            if(!IsotopomerComparator.isEnriched(reaction))
            {
                reference = reaction;
                break;
            }
        }

        if(reference == null)
        {
            // the kinetics of the stripped copy are those of a labelled reaction, only the symmetry is meaningful
            LOGGER.warn("no unlabeled reaction in the cluster of {}, using its stripped copy as the reference",
                    cluster.get(0));
            reference = stripper.strip(cluster.get(0));
            report.addSynthesizedReference(reference);
        }

        double referenceFactor = getPreExponentialFactor(reference);
        double referenceSymmetry = getReactionSymmetryNumber(reference);

        double[] expected = new double[cluster.size()];
        boolean[] reversed = new boolean[cluster.size()];

        for(int i = 0; i < cluster.size(); i++)
        {
            Reaction reaction = cluster.get(i);

            // A factors of the opposite direction are independent of the reference
            if(reaction != reference && !comparator.isIsomorphicForward(reaction, reference, false))
            {
                reversed[i] = true;
                continue;
            }

            getPreExponentialFactor(reaction);
            expected[i] = referenceFactor * getReactionSymmetryNumber(reaction) / referenceSymmetry;

            if(Double.isNaN(expected[i]) || Double.isInfinite(expected[i]))
                throw new NumericException("invalid pre-exponential factor " + expected[i] + " of reaction "
                        + reaction);
        }


        for(int i = 0; i < cluster.size(); i++)
        {
            Reaction reaction = cluster.get(i);

            if(reversed[i])
            {
                LOGGER.debug("reaction {} is written in the opposite direction to {}, A factor kept", reaction,
                        reference);
                report.addReversed(reaction);
                continue;
            }

            double factor = reaction.getKinetics().getPreExponentialFactor();

            if(!isClose(factor, expected[i]))
            {
                LOGGER.info("reaction {} ({}) initially had incorrect A factor {}, making it match unlabeled reaction "
                        + "{} ({}) with A factor {}", reaction.getIndex(), reaction, factor, reference.getIndex(),
                        reference, expected[i]);

                reaction.getKinetics().setPreExponentialFactor(expected[i]);
                report.addCorrection(reaction, reference, factor, expected[i]);
            }
        }


        // identical reactants collide twice as often as counted
        for(Reaction reaction : cluster)
        {
            List<Species> reactants = reaction.getReactants();
            Kinetics kinetics = reaction.getKinetics();

            if(reactants.size() != 2 || !(kinetics instanceof Arrhenius || kinetics instanceof ArrheniusEP))
                continue;

            if(comparator.isIsomorphic(reactants.get(0), reactants.get(1), true))
            {
                kinetics.setPreExponentialFactor(kinetics.getPreExponentialFactor() / 2);
                report.addHalved(reaction);
                LOGGER.debug("A factor of reaction {} halved for identical reactants", reaction);
            }
        }
    }


    private static double getPreExponentialFactor(Reaction reaction) throws ConfigurationException
    {
        Kinetics kinetics = reaction.getKinetics();

        if(kinetics == null)
            throw new ConfigurationException("reaction " + reaction + " has no kinetics");

        if(!kinetics.hasPreExponentialFactor())
            throw new ConfigurationException("kinetics of reaction " + reaction + " ("
                    + kinetics.getClass().getSimpleName() + ") has no pre-exponential factor");

        return kinetics.getPreExponentialFactor();
    }


    private boolean isClose(double value, double expected)
    {
        return Math.abs(value - expected) <= absoluteTolerance + relativeTolerance * Math.abs(expected);
    }
}
