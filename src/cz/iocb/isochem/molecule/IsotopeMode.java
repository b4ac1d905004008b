package cz.iocb.isochem.molecule;



public enum IsotopeMode
{
    IGNORE, DEFAULT_AS_STANDARD
}
