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
package cz.iocb.isochem.concentration;

import java.util.ArrayList;
import java.util.List;
import cz.iocb.isochem.isotopes.ConfigurationException;
import cz.iocb.isochem.isotopes.NumericException;
import cz.iocb.isochem.model.Species;



/**
 * Turns simulated concentrations of the species of isotopomer clusters into isotopomer probabilities.
 */
public class ConcentrationAggregator
{
    /**
     * Selects the concentration columns of every species cluster. A species is looked up under "label(index)"
     * first and under its plain label otherwise. Two species of one cluster must not share a column.
     */
    public List<ConcentrationTable> aggregate(ConcentrationTable table, List<List<Species>> clusters)
            throws ConfigurationException
    {
        List<ConcentrationTable> concentrations = new ArrayList<ConcentrationTable>(clusters.size());

        for(List<Species> cluster : clusters)
        {
            List<String> columns = new ArrayList<String>(cluster.size());

            for(Species species : cluster)
            {
                String column = getColumn(table, species);
                int idx = columns.indexOf(column);

                if(idx >= 0)
                    throw new ConfigurationException("species " + cluster.get(idx).getIndexedLabel() + " and "
                            + species.getIndexedLabel() + " resolve to the same concentration profile " + column);

                columns.add(column);
            }

            concentrations.add(table.select(columns));
        }

        return concentrations;
    }


    private static String getColumn(ConcentrationTable table, Species species) throws ConfigurationException
    {
        String header = species.getIndexedLabel();

        if(table.hasColumn(header))
            return header;

        header = species.getLabel();

        if(table.hasColumn(header))
            return header;

        throw new ConfigurationException("no concentration profile of species " + species.getIndexedLabel());
    }


    /**
     * Divides every concentration by the sum of the concentrations of its row.
     */
    public ConcentrationTable computeProbabilities(ConcentrationTable table) throws NumericException
    {
        int rowCount = table.getRowCount();
        int columnCount = table.getColumnCount();
        double[][] probabilities = new double[rowCount][columnCount];

        for(int row = 0; row < rowCount; row++)
        {
            double sum = 0.0;

            for(int column = 0; column < columnCount; column++)
                sum += table.getValue(row, column);

            if(sum == 0.0 || Double.isNaN(sum) || Double.isInfinite(sum))
                throw new NumericException("total concentration of " + table.getColumns() + " is " + sum
                        + " at time index " + row + " (" + table.getTimeColumn() + " = " + table.getTime(row) + ")");

            for(int column = 0; column < columnCount; column++)
                probabilities[row][column] = table.getValue(row, column) / sum;
        }

        return new ConcentrationTable(table.getTimeColumn(), table.getTimes(), table.getColumns(), probabilities);
    }
}
