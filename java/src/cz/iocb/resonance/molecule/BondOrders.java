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

import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.interfaces.IBond.Order;



/**
 * Bond order arithmetic over CDK bonds. A delocalized (benzene) bond is a bond with an unset order that is flagged
 * as aromatic, and has the order value 1.5.
 */
public class BondOrders
{
    public static final double DELOCALIZED = 1.5;


    public static boolean isDelocalized(IBond bond)
    {
        return (bond.getOrder() == null || bond.getOrder() == Order.UNSET) && bond.isAromatic();
    }


    public static boolean isSingle(IBond bond)
    {
        return bond.getOrder() == Order.SINGLE;
    }


    public static boolean isDouble(IBond bond)
    {
        return bond.getOrder() == Order.DOUBLE;
    }


    public static boolean isTriple(IBond bond)
    {
        return bond.getOrder() == Order.TRIPLE;
    }


    public static boolean isSupported(IBond bond)
    {
        return isDelocalized(bond) || isSingle(bond) || isDouble(bond) || isTriple(bond);
    }


    public static double getValue(IBond bond)
    {
        if(isDelocalized(bond))
            return DELOCALIZED;

        switch(bond.getOrder())
        {
            case SINGLE:
                return 1;
            case DOUBLE:
                return 2;
            case TRIPLE:
                return 3;
            default:
                throw new IllegalStateException("unsupported bond order: " + bond.getOrder());
        }
    }


    public static void setDelocalized(IBond bond)
    {
        bond.setOrder(Order.UNSET);
        bond.setIsAromatic(true);
    }


    public static void setOrder(IBond bond, Order order)
    {
        bond.setOrder(order);
        bond.setIsAromatic(false);
    }


    public static void increment(IBond bond)
    {
        if(isSingle(bond))
            setOrder(bond, Order.DOUBLE);
        else if(isDouble(bond))
            setOrder(bond, Order.TRIPLE);
        else
            throw new IllegalStateException("cannot increment bond order: " + bond.getOrder());
    }


    public static void decrement(IBond bond)
    {
        if(isTriple(bond))
            setOrder(bond, Order.DOUBLE);
        else if(isDouble(bond))
            setOrder(bond, Order.SINGLE);
        else
            throw new IllegalStateException("cannot decrement bond order: " + bond.getOrder());
    }
}
