package cz.iocb.isochem.isotopes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import cz.iocb.isochem.model.Reaction;



public class RateCorrectionReport
{
    public static class Correction
    {
        final public Reaction reaction;
        final public Reaction reference;
        final public double originalFactor;
        final public double correctedFactor;

        Correction(Reaction reaction, Reaction reference, double originalFactor, double correctedFactor)
        {
            this.reaction = reaction;
            this.reference = reference;
            this.originalFactor = originalFactor;
            this.correctedFactor = correctedFactor;
        }
    }


    public static class ClusterFailure
    {
        final public List<Reaction> cluster;
        final public IsotopeException cause;

        ClusterFailure(List<Reaction> cluster, IsotopeException cause)
        {
            this.cluster = cluster;
            this.cause = cause;
        }
    }


    private final List<Correction> corrections = new ArrayList<Correction>();
    private final List<Reaction> halved = new ArrayList<Reaction>();
    private final List<Reaction> reversed = new ArrayList<Reaction>();
    private final List<Reaction> synthesizedReferences = new ArrayList<Reaction>();
    private final List<ClusterFailure> failures = new ArrayList<ClusterFailure>();
    private int clusterCount;


    void addCorrection(Reaction reaction, Reaction reference, double originalFactor, double correctedFactor)
    {
        corrections.add(new Correction(reaction, reference, originalFactor, correctedFactor));
    }


    void addHalved(Reaction reaction)
    {
        halved.add(reaction);
    }


    void addReversed(Reaction reaction)
    {
        reversed.add(reaction);
    }


    void addSynthesizedReference(Reaction reference)
    {
        synthesizedReferences.add(reference);
    }


    void addFailure(List<Reaction> cluster, IsotopeException cause)
    {
        failures.add(new ClusterFailure(cluster, cause));
    }


    void setClusterCount(int clusterCount)
    {
        this.clusterCount = clusterCount;
    }


    public List<Correction> getCorrections()
    {
        return Collections.unmodifiableList(corrections);
    }


    public List<Reaction> getHalved()
    {
        return Collections.unmodifiableList(halved);
    }


    /** Cluster members written in the opposite direction to their reference; their A factors are not corrected. */
    public List<Reaction> getReversed()
    {
        return Collections.unmodifiableList(reversed);
    }


    public List<Reaction> getSynthesizedReferences()
    {
        return Collections.unmodifiableList(synthesizedReferences);
    }


    public List<ClusterFailure> getFailures()
    {
        return Collections.unmodifiableList(failures);
    }


    public int getClusterCount()
    {
        return clusterCount;
    }


    public boolean hasFailures()
    {
        return !failures.isEmpty();
    }
}
