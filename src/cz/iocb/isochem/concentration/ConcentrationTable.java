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
import java.util.Collections;
import java.util.List;



/**
 * Time-indexed table of concentration columns, one row per time sample.
 */
public class ConcentrationTable
{
    private final String timeColumn;
    private final double[] times;
    private final List<String> columns;
    private final double[][] values;


    public ConcentrationTable(String timeColumn, double[] times, List<String> columns, double[][] values)
    {
        if(values.length != times.length)
            throw new IllegalArgumentException("row count does not match the number of time samples");

        for(int row = 0; row < values.length; row++)
            if(values[row].length != columns.size())
                throw new IllegalArgumentException("row " + row + " has " + values[row].length + " values, "
                        + columns.size() + " expected");

        this.timeColumn = timeColumn;
        this.times = times.clone();
        this.columns = Collections.unmodifiableList(new ArrayList<String>(columns));
        this.values = new double[values.length][];

        for(int row = 0; row < values.length; row++)
            this.values[row] = values[row].clone();
    }


    public String getTimeColumn()
    {
        return timeColumn;
    }


    public int getRowCount()
    {
        return times.length;
    }


    public int getColumnCount()
    {
        return columns.size();
    }


    public List<String> getColumns()
    {
        return columns;
    }


    public boolean hasColumn(String column)
    {
        return columns.contains(column);
    }


    public double getTime(int row)
    {
        return times[row];
    }


    public double[] getTimes()
    {
        return times.clone();
    }


    public double getValue(int row, int column)
    {
        return values[row][column];
    }


    public double getValue(int row, String column)
    {
        return values[row][indexOf(column)];
    }


    public double[] getColumn(String column)
    {
        int idx = indexOf(column);
        double[] result = new double[times.length];

        for(int row = 0; row < times.length; row++)
            result[row] = values[row][idx];

        return result;
    }


    /**
     * Returns a table with the given columns only, in the given order.
     */
    public ConcentrationTable select(List<String> selected)
    {
        int[] indexes = new int[selected.size()];

        for(int i = 0; i < indexes.length; i++)
            indexes[i] = indexOf(selected.get(i));

        double[][] data = new double[times.length][indexes.length];

        for(int row = 0; row < times.length; row++)
            for(int i = 0; i < indexes.length; i++)
                data[row][i] = values[row][indexes[i]];

        return new ConcentrationTable(timeColumn, times, selected, data);
    }


    private int indexOf(String column)
    {
        int idx = columns.indexOf(column);

        if(idx < 0)
            throw new IllegalArgumentException("unknown column " + column);

        return idx;
    }
}
