/*
 * Copyright (C) 2015-2017 Jakub Galgonek   galgonek@uochb.cas.cz
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
package cz.iocb.resonance.molecule;

import java.util.List;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;



/**
 * Features of a molecule that select the resonance methods applied to it
 */
public class MoleculeFeatures
{
    public boolean isRadical;
    public boolean isCyclic;
    public boolean isAromatic;
    public boolean isPolycyclicAromatic;
    public boolean isArylRadical;
    public boolean hasNitrogen;
    public boolean hasOxygen;
    public boolean hasLonePairs;


    public MoleculeFeatures(IAtomContainer molecule)
    {
        isRadical = Electrons.isRadical(molecule);
        isCyclic = Rings.isCyclic(molecule);

        if(isCyclic)
        {
            List<AromaticRing> aromaticRings = Rings.getAromaticRings(molecule);

            isAromatic = aromaticRings.size() > 0;
            isPolycyclicAromatic = aromaticRings.size() > 1;

            if(isRadical && isAromatic)
                isArylRadical = Rings.isArylRadical(molecule, aromaticRings);
        }

        for(IAtom atom : molecule.atoms())
        {
            if(Electrons.isNitrogen(atom))
                hasNitrogen = true;
            else if(Electrons.isOxygen(atom))
                hasOxygen = true;

            if(Electrons.getLonePairCount(molecule, atom) > 0)
                hasLonePairs = true;
        }
    }


    @Override
    public String toString()
    {
        return "radical=" + isRadical + ", cyclic=" + isCyclic + ", aromatic=" + isAromatic + ", polycyclicAromatic="
                + isPolycyclicAromatic + ", arylRadical=" + isArylRadical + ", nitrogen=" + hasNitrogen + ", oxygen="
                + hasOxygen + ", lonePairs=" + hasLonePairs;
    }
}
