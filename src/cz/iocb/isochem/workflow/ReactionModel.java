package cz.iocb.isochem.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import cz.iocb.isochem.model.Reaction;
import cz.iocb.isochem.model.Species;



public class ReactionModel
{
    private final List<Species> species;
    private final List<Reaction> reactions;


    public ReactionModel(List<Species> species, List<Reaction> reactions)
    {
        this.species = Collections.unmodifiableList(new ArrayList<Species>(species));
        this.reactions = Collections.unmodifiableList(new ArrayList<Reaction>(reactions));
    }


    public List<Species> getSpecies()
    {
        return species;
    }


    public List<Reaction> getReactions()
    {
        return reactions;
    }
}
