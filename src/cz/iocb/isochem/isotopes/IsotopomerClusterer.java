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

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;



/**
 * Splits species or reactions into clusters whose members differ only in their isotope labelling.
 *
 * A candidate is compared with the first member of every cluster only, so the clustering is correct as long as the
 * stripped isomorphism is transitive.
 */
public class IsotopomerClusterer
{
    private final IsotopomerComparator comparator;


    public IsotopomerClusterer(IsotopomerComparator comparator)
    {
        this.comparator = comparator;
    }


    public <T> List<List<T>> cluster(List<T> entities)
    {
        Class<?> type = null;

        for(T entity : entities)
        {
            IsotopomerComparator.checkEntity(entity);

            if(type == null)
                type = entity.getClass();
            else if(type != entity.getClass())
                throw new IllegalArgumentException("species and reactions cannot be clustered together");
        }


        LinkedList<T> unclustered = new LinkedList<T>(entities);
        List<List<T>> clusters = new ArrayList<List<T>>();

        while(!unclustered.isEmpty())
        {
            T candidate = unclustered.remove();
            List<T> selected = null;

            for(List<T> cluster : clusters)
            {
                if(comparator.sameIsotopomerFamily(cluster.get(0), candidate))
                {
                    selected = cluster;
                    break;
                }
            }

            if(selected == null)
            {
                selected = new ArrayList<T>();
                clusters.add(selected);
            }

            selected.add(candidate);
        }

        return clusters;
    }
}
