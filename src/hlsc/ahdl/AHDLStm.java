package hlsc.ahdl;

public abstract class AHDLStm extends AHDL {}
