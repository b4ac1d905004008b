/*
 * Copyright (C) 2015-2020 Jakub Galgonek   galgonek@uochb.cas.cz
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU Lesser General
 * Public License as published by the Free Software Foundation; either version 2.1 of the License, or (at your option)
 * any later version. All we ask is that proper credit is given for our work, which includes - but is not limited to -
 * adding the above copyright notice to the beginning of your source code files, and to any copyright notice that you
 * may distribute with programs based on this work.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for more
 * details.
 */
package cz.iocb.isochem.isotopes;



/**
 * Required input is missing or malformed, e.g. a rate law without the pre-exponential factor that has to be corrected.
 */
@SuppressWarnings("serial")
public class ConfigurationException extends IsotopeException
{
    public ConfigurationException(String message)
    {
        super(message);
    }


    public ConfigurationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
