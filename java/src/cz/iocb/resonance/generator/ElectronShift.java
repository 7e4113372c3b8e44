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
package cz.iocb.resonance.generator;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.resonance.molecule.AtomTypeException;
import cz.iocb.resonance.molecule.AtomTypes;
import cz.iocb.resonance.molecule.BondOrders;
import cz.iocb.resonance.molecule.ConnectivityLabels;
import cz.iocb.resonance.molecule.Electrons;
import cz.iocb.resonance.pathfinder.DelocalizationPath;
import cz.iocb.resonance.pathfinder.PathFinder;



/**
 * Electron shifts along delocalization paths. Each shift produces a candidate structure as a modified copy of the
 * input molecule; the input itself is never modified.
 */
public enum ElectronShift
{
    /**
     * Allyl radical shift: the radical moves from atom1 to atom3 while the double bond moves from bond23 to bond12.
     */
    ADJACENT
    {
        @Override
        public boolean isApplicable(IAtomContainer molecule)
        {
            return Electrons.isRadical(molecule);
        }


        @Override
        public List<DelocalizationPath> findPaths(IAtomContainer molecule, IAtom atom)
        {
            return PathFinder.findAllDelocalizationPaths(molecule, atom);
        }


        @Override
        public void shift(IAtomContainer molecule, DelocalizationPath path)
        {
            Electrons.decrementRadical(molecule, path.getAtom(molecule, 0));
            Electrons.incrementRadical(molecule, path.getAtom(molecule, 2));
            BondOrders.increment(path.getBond(molecule, 0));
            BondOrders.decrement(path.getBond(molecule, 1));
        }


        @Override
        public void unshift(IAtomContainer molecule, DelocalizationPath path)
        {
            Electrons.incrementRadical(molecule, path.getAtom(molecule, 0));
            Electrons.decrementRadical(molecule, path.getAtom(molecule, 2));
            BondOrders.decrement(path.getBond(molecule, 0));
            BondOrders.increment(path.getBond(molecule, 1));
        }
    },

    /**
     * The radical of atom1 pairs into a lone pair while a lone pair of atom2 splits into a radical.
     */
    LONE_PAIR_RADICAL
    {
        @Override
        public boolean isApplicable(IAtomContainer molecule)
        {
            return Electrons.isRadical(molecule);
        }


        @Override
        public List<DelocalizationPath> findPaths(IAtomContainer molecule, IAtom atom)
        {
            return PathFinder.findAllDelocalizationPathsLonePairRadical(molecule, atom);
        }


        @Override
        public void shift(IAtomContainer molecule, DelocalizationPath path)
        {
            IAtom atom1 = path.getAtom(molecule, 0);
            IAtom atom2 = path.getAtom(molecule, 1);

            Electrons.decrementRadical(molecule, atom1);
            Electrons.incrementLonePairs(molecule, atom1);
            Electrons.updateCharge(molecule, atom1);
            Electrons.incrementRadical(molecule, atom2);
            Electrons.decrementLonePairs(molecule, atom2);
            Electrons.updateCharge(molecule, atom2);
        }


        @Override
        public void unshift(IAtomContainer molecule, DelocalizationPath path)
        {
            IAtom atom1 = path.getAtom(molecule, 0);
            IAtom atom2 = path.getAtom(molecule, 1);

            Electrons.incrementRadical(molecule, atom1);
            Electrons.decrementLonePairs(molecule, atom1);
            Electrons.updateCharge(molecule, atom1);
            Electrons.decrementRadical(molecule, atom2);
            Electrons.incrementLonePairs(molecule, atom2);
            Electrons.updateCharge(molecule, atom2);
        }
    },

    /**
     * Shift between a nitrogen with two double bonds (N5dd) and a nitrogen with a triple and a single bond (N5ts).
     * Both directions move one bond order from bond12 to bond13 and one lone pair from atom3 to atom2.
     */
    N5DD_N5TS
    {
        @Override
        public boolean isApplicable(IAtomContainer molecule)
        {
            for(IAtom atom : molecule.atoms())
                if(Electrons.isNitrogen(atom))
                    return true;

            return false;
        }


        @Override
        public List<DelocalizationPath> findPaths(IAtomContainer molecule, IAtom atom)
        {
            return PathFinder.findAllDelocalizationPathsN5dd_N5ts(molecule, atom);
        }


        @Override
        public void shift(IAtomContainer molecule, DelocalizationPath path)
        {
            BondOrders.decrement(path.getBond(molecule, 0));
            BondOrders.increment(path.getBond(molecule, 1));
            Electrons.incrementLonePairs(molecule, path.getAtom(molecule, 1));
            Electrons.decrementLonePairs(molecule, path.getAtom(molecule, 2));
            updateCharges(molecule, path);
        }


        @Override
        public void unshift(IAtomContainer molecule, DelocalizationPath path)
        {
            BondOrders.increment(path.getBond(molecule, 0));
            BondOrders.decrement(path.getBond(molecule, 1));
            Electrons.decrementLonePairs(molecule, path.getAtom(molecule, 1));
            Electrons.incrementLonePairs(molecule, path.getAtom(molecule, 2));
            updateCharges(molecule, path);
        }


        private void updateCharges(IAtomContainer molecule, DelocalizationPath path)
        {
            for(int i = 0; i < path.getAtomCount(); i++)
                Electrons.updateCharge(molecule, path.getAtom(molecule, i));
        }
    };


    private static final Logger LOGGER = LogManager.getFormatterLogger(ElectronShift.class);


    public abstract boolean isApplicable(IAtomContainer molecule);


    public abstract List<DelocalizationPath> findPaths(IAtomContainer molecule, IAtom atom);


    /**
     * Applies the shift to the molecule in place.
     *
     * @param molecule
     * @param path path found on the molecule or on any of its copies
     */
    public abstract void shift(IAtomContainer molecule, DelocalizationPath path);


    /**
     * Reverts {@link #shift(IAtomContainer, DelocalizationPath)} exactly.
     *
     * @param molecule
     * @param path
     */
    public abstract void unshift(IAtomContainer molecule, DelocalizationPath path);


    public List<DelocalizationPath> findAllPaths(IAtomContainer molecule)
    {
        List<DelocalizationPath> paths = new ArrayList<DelocalizationPath>();

        if(!isApplicable(molecule))
            return paths;

        for(IAtom atom : molecule.atoms())
            paths.addAll(findPaths(molecule, atom));

        return paths;
    }


    /**
     * Generates all structures reachable from the molecule by a single shift. Candidates that fail atom type
     * validation are kept.
     *
     * @param molecule
     * @return candidate structures, one per delocalization path
     * @throws CloneNotSupportedException
     */
    public List<IAtomContainer> generate(IAtomContainer molecule) throws CloneNotSupportedException
    {
        List<IAtomContainer> isomers = new ArrayList<IAtomContainer>();

        for(DelocalizationPath path : findAllPaths(molecule))
        {
            IAtomContainer isomer = molecule.clone();
            ConnectivityLabels.copy(molecule, isomer);

            shift(isomer, path);

            try
            {
                AtomTypes.validate(isomer);
            }
            catch(AtomTypeException e)
            {
                LOGGER.debug("%s shift along %s gives an invalid structure: %s", name(), path, e.getMessage());
            }

            isomers.add(isomer);
        }

        return isomers;
    }
}
