package cz.iocb.isochem.isotopes;

import org.openscience.cdk.exception.CDKException;



@SuppressWarnings("serial")
public class IsotopeException extends CDKException
{
    public IsotopeException(String message)
    {
        super(message);
    }


    public IsotopeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
