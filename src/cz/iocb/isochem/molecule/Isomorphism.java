/*
 * Copyright (C) 2001
 *   Dipartimento di Informatica e Sistemistica,
 *   Universita degli studi di Napoli ``Federico II'
 *   <http://amalfi.dis.unina.it>
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and
 * associated documentation files (the "Software"), to deal in the Software without restriction, including
 * without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies
 * of the Software, and to permit persons to whom the Software is furnished to do so, subject to the
 * following conditions:
 *
 *  1. The above copyright notice and this permission notice shall be included in all copies or substantial
 *      portions of the Software, together with the associated disclaimers.
 *  2. Any modification to the standard distribution of the Software shall be mentioned in a prominent notice
 *      in the documentation provided with the modified distribution, stating clearly how, when and by
 *      whom the Software has been modified.
 *  3. Either the modified distribution shall contain the entire sourcecode of the standard distribution of the
 *      Software, or the documentation shall provide instructions on where the source code of the standard
 *      distribution of the Software can be obtained.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED,
 * INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR
 * PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE
 * FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR
 * OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER
 * DEALINGS IN THE SOFTWARE.
 *
 * Modified by Jakub Galgonek: exact matching of labelled structures only, counting of all mappings.
 */
package cz.iocb.isochem.molecule;

import java.util.Arrays;



/**
 * VF2 exact (whole graph) isomorphism of two structures. With {@link IsotopeMode#DEFAULT_AS_STANDARD} the atoms must
 * carry the same isotope, with {@link IsotopeMode#IGNORE} isotopes are not compared at all.
 */
public class Isomorphism
{
    private static final int UNDEFINED_CORE = -1;

    private final IsotopeMode isotopeMode;

    private final Molecule query;
    private final int queryAtomCount;
    private final int[] queryOrder;
    private final int[] queryParents;


    public Isomorphism(Molecule query)
    {
        this(query, IsotopeMode.DEFAULT_AS_STANDARD);
    }


    public Isomorphism(Molecule query, IsotopeMode isotopeMode)
    {
        int queryAtomCount = query.getAtomCount();

        this.isotopeMode = isotopeMode;
        this.query = query;
        this.queryAtomCount = queryAtomCount;
        this.queryOrder = new int[queryAtomCount];
        this.queryParents = new int[queryAtomCount];

        Arrays.fill(this.queryParents, -1);

        byte[] queryFlags = new byte[queryAtomCount];

        for(int idx = 0; idx < queryAtomCount; idx++)
        {
            int selected = -1;
            int fallback = -1;

            for(int i = 0; i < queryAtomCount; i++)
            {
                if(queryFlags[i] == 1)
                {
                    selected = i;
                    break;
                }

                if(fallback == -1 && queryFlags[i] == 0)
                    fallback = i;
            }

            if(selected == -1)
                selected = fallback;


            int[] queryBondedAtoms = query.getBondedAtoms(selected);

            queryFlags[selected] = 2;

            for(int i = 0; i < queryBondedAtoms.length; i++)
            {
                int idx2 = queryBondedAtoms[i];

                if(queryFlags[idx2] == 0)
                {
                    queryFlags[idx2] = 1;
                    this.queryParents[idx2] = selected;
                }
            }

            this.queryOrder[idx] = selected;
        }
    }


    public final boolean match(Molecule target)
    {
        return new VF2State().match(target, 1) > 0;
    }


    /**
     * Counts the distinct atom mappings of the query onto the target. A non-positive limit means no limit.
     */
    public final int countMatches(Molecule target, int limit)
    {
        return new VF2State().match(target, limit);
    }


    private final class VF2State
    {
        private final int[] queryCore;
        private final int[] undosTargetSelector;
        private final int[] undosTargetIdx;
        private Molecule target;
        private int targetAtomCount;
        private int[] targetCore;
        private int targetSelector;
        private int targetIdx;
        private int coreLength;
        private int queryIdx;


        private VF2State()
        {
            this.coreLength = 0;
            this.queryCore = new int[queryAtomCount];
            this.undosTargetSelector = new int[queryAtomCount];
            this.undosTargetIdx = new int[queryAtomCount];
        }


        private final boolean nextQuery()
        {
            if(coreLength >= queryAtomCount)
                return false;

            queryIdx = queryOrder[coreLength];
            targetIdx = -1;
            targetSelector = -1;

            return true;
        }


        private final boolean nextTarget()
        {
            int queryParent = queryParents[queryIdx];

            if(queryParent >= 0)
            {
                int targetParent = queryCore[queryParent];
                int[] targetBondedAtoms = target.getBondedAtoms(targetParent);

                for(targetSelector++; targetSelector < targetBondedAtoms.length; targetSelector++)
                {
                    int newTargetIdx = targetBondedAtoms[targetSelector];

                    if(!isCoreDefined(targetCore[newTargetIdx]))
                    {
                        targetIdx = newTargetIdx;
                        return true;
                    }
                }
            }
            else
            {
                for(targetIdx++; targetIdx < targetAtomCount; targetIdx++)
                {
                    if(!isCoreDefined(targetCore[targetIdx]))
                        return true;
                }
            }

            return false;
        }


        private final boolean atomMatches(int queryAtom, int targetAtom)
        {
            byte queryNumber = query.getAtomNumber(queryAtom);
            byte targetNumber = target.getAtomNumber(targetAtom);

            if(queryNumber != targetNumber)
                return false;
            else if(query.isAtomPseudo(queryAtom))
                return query.getAtomLabel(queryAtom) != null
                        && query.getAtomLabel(queryAtom).equals(target.getAtomLabel(targetAtom));
            else
                return true;
        }


        private final boolean bondMatches(int qIdx1, int qIdx2, int tIdx1, int tIdx2)
        {
            int queryBond = query.getBond(qIdx1, qIdx2);
            int targetbond = target.getBond(tIdx1, tIdx2);

            if(queryBond < 0 || targetbond < 0)
                return false;

            return query.getBondType(queryBond) == target.getBondType(targetbond);
        }


        private final boolean isFeasiblePair()
        {
            if(!atomMatches(queryIdx, targetIdx))
                return false;

            if(query.getAtomFormalCharge(queryIdx) != target.getAtomFormalCharge(targetIdx))
                return false;

            if(query.getAtomRadicalCount(queryIdx) != target.getAtomRadicalCount(targetIdx))
                return false;

            if(query.getAtomHydrogenCount(queryIdx) != target.getAtomHydrogenCount(targetIdx))
                return false;

            if(isotopeMode != IsotopeMode.IGNORE && query.getAtomMass(queryIdx) != target.getAtomMass(targetIdx))
                return false;


            int newQuery = 0;
            int newTarget = 0;

            int[] queryBondedAtoms = query.getBondedAtoms(queryIdx);

            for(int other1 : queryBondedAtoms)
            {
                if(isCoreDefined(queryCore[other1]))
                {
                    int other2 = queryCore[other1];

                    if(!bondMatches(queryIdx, other1, targetIdx, other2))
                        return false;
                }
                else
                {
                    newQuery++;
                }
            }


            int[] targetBondedAtoms = target.getBondedAtoms(targetIdx);

            for(int other2 : targetBondedAtoms)
            {
                if(isCoreDefined(targetCore[other2]))
                {
                    int other1 = targetCore[other2];

                    if(!bondMatches(queryIdx, other1, targetIdx, other2))
                        return false;
                }
                else
                {
                    newTarget++;
                }
            }

            return newQuery == newTarget;
        }


        private final void undoAddPair()
        {
            coreLength--;
            int undoTargetSelector = undosTargetSelector[coreLength];
            int undoTargetIdx = undosTargetIdx[coreLength];

            queryIdx = queryOrder[coreLength];

            queryCore[queryIdx] = UNDEFINED_CORE;
            targetCore[undoTargetIdx] = UNDEFINED_CORE;

            targetSelector = undoTargetSelector;
            targetIdx = undoTargetIdx;
        }


        private final void addPair()
        {
            undosTargetSelector[coreLength] = targetSelector;
            undosTargetIdx[coreLength] = targetIdx;

            coreLength++;
            queryCore[queryIdx] = targetIdx;
            targetCore[targetIdx] = queryIdx;
        }


        private final int matchCore(int limit)
        {
            int count = 0;

            recursion:
            while(true)
            {
                if(coreLength == queryAtomCount)
                {
                    count++;

                    if(count == limit)
                        return count;
                }

                if(coreLength == queryAtomCount || !nextQuery())
                {
                    if(coreLength == 0)
                        return count;

                    undoAddPair();
                }

                while(true)
                {
                    while(nextTarget())
                    {
                        if(isFeasiblePair())
                        {
                            addPair();
                            continue recursion;
                        }
                    }

                    if(coreLength == 0)
                        return count;

                    undoAddPair();
                }
            }
        }


        private final int match(Molecule target, int limit)
        {
            if(queryAtomCount != target.getAtomCount() || query.getBondCount() != target.getBondCount())
                return 0;

            int targetAtomCount = target.getAtomCount();

            this.target = target;
            this.targetAtomCount = targetAtomCount;
            coreLength = 0;

            targetCore = new int[targetAtomCount];

            Arrays.fill(targetCore, UNDEFINED_CORE);
            Arrays.fill(queryCore, UNDEFINED_CORE);

            return matchCore(limit);
        }
    }


    private static final boolean isCoreDefined(int value)
    {
        return value >= 0;
    }
}
