package cz.iocb.isochem.workflow;

import java.io.IOException;
import cz.iocb.isochem.concentration.ConcentrationTable;



/**
 * Simulates a reaction model and returns the concentration profiles of its species, with one column per species
 * named after {@link cz.iocb.isochem.model.Species#getIndexedLabel()}.
 */
public interface Simulator
{
    ConcentrationTable simulate(ReactionModel model) throws IOException;
}
