package cz.iocb.isochem.molecule;

import org.openscience.cdk.interfaces.IAtomContainer;



public interface SymmetryNumberProvider
{
    double symmetryNumber(IAtomContainer molecule);
}
