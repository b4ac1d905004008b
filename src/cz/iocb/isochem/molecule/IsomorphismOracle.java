package cz.iocb.isochem.molecule;

import org.openscience.cdk.interfaces.IAtomContainer;



/**
 * Decides whether two structures are the same graph. Implementations must be deterministic and must not modify the
 * structures.
 */
public interface IsomorphismOracle
{
    boolean isomorphic(IAtomContainer molecule, IAtomContainer other, boolean labelSensitive);
}
