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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.openscience.cdk.exception.CDKException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import cz.iocb.isochem.concentration.ConcentrationAggregator;
import cz.iocb.isochem.concentration.ConcentrationTable;
import cz.iocb.isochem.isotopes.IsotopeStripper;
import cz.iocb.isochem.isotopes.IsotopomerClusterer;
import cz.iocb.isochem.isotopes.IsotopomerComparator;
import cz.iocb.isochem.isotopes.IsotopomerGenerator;
import cz.iocb.isochem.isotopes.NumericException;
import cz.iocb.isochem.isotopes.RateCorrectionReport;
import cz.iocb.isochem.isotopes.SymmetryCorrector;
import cz.iocb.isochem.model.Species;
import cz.iocb.isochem.molecule.AutomorphismSymmetryNumber;
import cz.iocb.isochem.molecule.IsomorphismOracle;
import cz.iocb.isochem.molecule.ResonanceGenerator;
import cz.iocb.isochem.molecule.StructureIsomorphismOracle;
import cz.iocb.isochem.molecule.SymmetryNumberProvider;
import cz.iocb.isochem.workflow.IsotopeResult.ClusterResult;



/**
 * Builds and simulates the isotope labelled counterpart of a reaction model: generates the isotopomers of the core
 * species, lets the expander build the model spanned by them, makes the pre-exponential factors consistent, simulates
 * the model and computes the isotopomer probabilities of every species cluster.
 */
public class IsotopeWorkflow
{
    private static final Logger LOGGER = LoggerFactory.getLogger(IsotopeWorkflow.class);

    private final IsotopeSettings settings;
    private final ReactionNetworkExpander expander;
    private final Simulator simulator;

    private final IsotopomerGenerator generator;
    private final IsotopomerClusterer clusterer;
    private final SymmetryCorrector corrector;
    private final ConcentrationAggregator aggregator = new ConcentrationAggregator();


    public IsotopeWorkflow(IsotopeSettings settings, ReactionNetworkExpander expander, Simulator simulator)
    {
        this(settings, expander, simulator, new StructureIsomorphismOracle(), new AutomorphismSymmetryNumber(),
                ResonanceGenerator.NONE);
    }


    public IsotopeWorkflow(IsotopeSettings settings, ReactionNetworkExpander expander, Simulator simulator,
            IsomorphismOracle oracle, SymmetryNumberProvider symmetry, ResonanceGenerator resonanceGenerator)
    {
        IsotopeStripper stripper = new IsotopeStripper(resonanceGenerator);
        IsotopomerComparator comparator = new IsotopomerComparator(oracle, stripper,
                settings.isCheckReverseReactions());

        this.settings = settings;
        this.expander = expander;
        this.simulator = simulator;
        this.corrector = new SymmetryCorrector(symmetry, comparator, stripper, settings.getRateRelativeTolerance(),
                settings.getRateAbsoluteTolerance());
        this.generator = new IsotopomerGenerator(oracle, corrector, resonanceGenerator, settings.getElement(),
                settings.getMassNumber());
        this.clusterer = new IsotopomerClusterer(comparator);
    }


    public IsotopeResult run(List<Species> coreSpecies) throws CDKException, IOException
    {
        LOGGER.info("generating isotopomers of {} core species using {}", coreSpecies.size(), settings);

        List<Species> species = new ArrayList<Species>(
                generator.generateAll(coreSpecies, settings.getMaximumIsotopicAtoms()));
        species.addAll(coreSpecies);

        LOGGER.info("number of isotopomers: {}", species.size());


        LOGGER.info("expanding the isotope model");
        ReactionModel model = expander.expand(species);

        LOGGER.info("correcting A factors of {} reactions", model.getReactions().size());
        RateCorrectionReport report = corrector.correctRateFactors(model.getReactions());

        if(report.hasFailures())
            LOGGER.warn("A factors of {} of {} reaction clusters were not corrected", report.getFailures().size(),
                    report.getClusterCount());


        LOGGER.info("clustering {} isotopomers", model.getSpecies().size());
        List<List<Species>> clusters = clusterer.cluster(model.getSpecies());

        LOGGER.info("simulating the isotope model");
        ConcentrationTable concentrations = simulator.simulate(model);

        LOGGER.info("computing isotopomer probabilities of {} clusters", clusters.size());
        List<ConcentrationTable> tables = aggregator.aggregate(concentrations, clusters);
        List<ClusterResult> results = new ArrayList<ClusterResult>(clusters.size());

        for(int i = 0; i < clusters.size(); i++)
        {
            try
            {
                ConcentrationTable probabilities = aggregator.computeProbabilities(tables.get(i));
                results.add(new ClusterResult(clusters.get(i), tables.get(i), probabilities, null));
            }
            catch(NumericException e)
            {
                LOGGER.error("isotopomer probabilities of {} cannot be computed: {}", clusters.get(i).get(0),
                        e.getMessage());
                results.add(new ClusterResult(clusters.get(i), tables.get(i), null, e));
            }
        }

        return new IsotopeResult(model, concentrations, report, results);
    }
}
