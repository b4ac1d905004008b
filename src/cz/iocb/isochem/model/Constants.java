package cz.iocb.isochem.model;



public abstract class Constants
{
    /** Gas constant in J/(mol K). */
    public static final double R = 8.314462618;
}
