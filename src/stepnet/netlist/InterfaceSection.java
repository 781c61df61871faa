package stepnet.netlist;

/** The fixed interface sections, in schema order. */
public enum InterfaceSection { Input, Output, InOut, Static, Temp, Constant }
