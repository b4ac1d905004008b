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

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;



/**
 * Reads a simulation profile: a CSV file with a header row, the time in the first column and one concentration (or
 * mole fraction) column per species.
 */
public class SimulationProfileReader
{
    public static final CSVFormat PROFILE_FORMAT = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true).setIgnoreSurroundingSpaces(true).build();


    public ConcentrationTable read(Reader reader) throws IOException
    {
        try(CSVParser parser = new CSVParser(reader, PROFILE_FORMAT))
        {
            List<String> headers = parser.getHeaderNames();

            if(headers.isEmpty())
                throw new IOException("simulation profile has no columns");

            List<String> columns = new ArrayList<String>(headers.subList(1, headers.size()));
            List<double[]> rows = new ArrayList<double[]>();
            List<Double> times = new ArrayList<Double>();

            for(CSVRecord record : parser)
            {
                if(record.size() != headers.size())
                    throw new IOException("line " + record.getRecordNumber() + ": " + record.size() + " values, "
                            + headers.size() + " expected");

                times.add(parse(record, 0));

                double[] row = new double[columns.size()];

                for(int i = 0; i < row.length; i++)
                    row[i] = parse(record, i + 1);

                rows.add(row);
            }

            double[] timeArray = new double[times.size()];

            for(int i = 0; i < timeArray.length; i++)
                timeArray[i] = times.get(i);

            return new ConcentrationTable(headers.get(0), timeArray, columns, rows.toArray(new double[0][]));
        }
    }


    private static double parse(CSVRecord record, int idx) throws IOException
    {
        try
        {
            return Double.parseDouble(record.get(idx));
        }
        catch(NumberFormatException e)
        {
            throw new IOException("line " + record.getRecordNumber() + ": invalid number " + record.get(idx), e);
        }
    }
}
