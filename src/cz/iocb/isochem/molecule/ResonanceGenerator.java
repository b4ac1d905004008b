package cz.iocb.isochem.molecule;

import java.util.Collections;
import java.util.List;
import org.openscience.cdk.interfaces.IAtomContainer;



/**
 * Provides the resonance forms of a structure. The first returned structure is the given structure itself.
 */
public interface ResonanceGenerator
{
    public static final ResonanceGenerator NONE = molecule -> Collections.singletonList(molecule);


    List<IAtomContainer> generate(IAtomContainer molecule);
}
