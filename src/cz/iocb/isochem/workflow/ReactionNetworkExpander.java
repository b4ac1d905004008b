package cz.iocb.isochem.workflow;

import java.util.List;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.isochem.model.Species;



/**
 * Builds the reaction model spanned by the given initial species, e.g. by applying reaction families.
 */
public interface ReactionNetworkExpander
{
    ReactionModel expand(List<Species> species) throws CDKException;
}
