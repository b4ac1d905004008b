package cz.iocb.isochem.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import cz.iocb.isochem.concentration.ConcentrationTable;
import cz.iocb.isochem.isotopes.NumericException;
import cz.iocb.isochem.isotopes.RateCorrectionReport;
import cz.iocb.isochem.model.Species;



public class IsotopeResult
{
    public static class ClusterResult
    {
        final public List<Species> species;
        final public ConcentrationTable concentrations;
        final public ConcentrationTable probabilities;
        final public NumericException failure;

        ClusterResult(List<Species> species, ConcentrationTable concentrations, ConcentrationTable probabilities,
                NumericException failure)
        {
            this.species = species;
            this.concentrations = concentrations;
            this.probabilities = probabilities;
            this.failure = failure;
        }

        public boolean isFailed()
        {
            return failure != null;
        }
    }


    private final ReactionModel model;
    private final ConcentrationTable concentrations;
    private final RateCorrectionReport rateCorrections;
    private final List<ClusterResult> clusters;


    IsotopeResult(ReactionModel model, ConcentrationTable concentrations, RateCorrectionReport rateCorrections,
            List<ClusterResult> clusters)
    {
        this.model = model;
        this.concentrations = concentrations;
        this.rateCorrections = rateCorrections;
        this.clusters = Collections.unmodifiableList(new ArrayList<ClusterResult>(clusters));
    }


    public ReactionModel getModel()
    {
        return model;
    }


    /** Raw concentration profiles of all species of the model. */
    public ConcentrationTable getConcentrations()
    {
        return concentrations;
    }


    public RateCorrectionReport getRateCorrections()
    {
        return rateCorrections;
    }


    public List<ClusterResult> getClusters()
    {
        return clusters;
    }


    /** Isotopomer probability tables of the clusters whose probabilities could be computed. */
    public List<ConcentrationTable> getProbabilities()
    {
        List<ConcentrationTable> probabilities = new ArrayList<ConcentrationTable>(clusters.size());

        for(ClusterResult cluster : clusters)
            if(!cluster.isFailed())
                probabilities.add(cluster.probabilities);

        return probabilities;
    }
}
