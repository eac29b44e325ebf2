package iwfmsubmodel.rewriter.simulation.rootzone;

import iwfmsubmodel.config.SimulationFiles;
import lombok.AccessLevel;
import lombok.Getter;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Disposición de los ficheros de cada uso del suelo de la zona radicular.
 * <p>
 * Todos nombran su fichero de superficies, llevan una cabecera de factores y ficheros y
 * después secciones de parámetros por elemento. Cada entrada de {@link #getSectionSkips()}
 * es el número de líneas de datos que preceden a la sección correspondiente.
 */
@Getter
public enum LandUseComponent {

    NON_PONDED_CROPS("cultivos no inundados", true, 0, true, 4,
            new int[]{0, 0, 0, 0, 1, 1, 0, 0}, 1,
            SimulationFiles::getNonPondedCropFile, SimulationFiles::getNonPondedAreaFile),
    PONDED_CROPS("cultivos inundados", false, 5, true, 3,
            new int[]{0, 0, 0, 0, 2, 0, 0, 0}, 0,
            SimulationFiles::getPondedCropFile, SimulationFiles::getPondedAreaFile),
    URBAN("urbano", false, 0, false, 5,
            new int[]{0}, 0,
            SimulationFiles::getUrbanFile, SimulationFiles::getUrbanAreaFile),
    NATIVE_VEGETATION("vegetación nativa", false, 0, false, 3,
            new int[]{0}, 0,
            SimulationFiles::getNativeVegetationFile, SimulationFiles::getNativeVegetationAreaFile);

    private final String description;
    /** Si el fichero empieza con el número de cultivos (NCROP). */
    private final boolean cropCountFirst;
    /** Número de cultivos cuando es fijo. */
    private final int fixedCrops;
    /** Si tras el fichero de superficies viene NBUD con sus ficheros de presupuesto. */
    private final boolean budgetSection;
    /**
     * Líneas de cabecera antes de la primera sección por elemento, sin contar las que
     * dependen de NBUD y del número de cultivos.
     */
    private final int headerLines;
    private final int[] sectionSkips;
    /** Líneas de datos antes de las condiciones iniciales. */
    private final int initialConditionSkip;

    @Getter(AccessLevel.NONE)
    private final Function<SimulationFiles, Path> componentFile;
    @Getter(AccessLevel.NONE)
    private final Function<SimulationFiles, Path> areaFile;

    LandUseComponent(String description, boolean cropCountFirst, int fixedCrops, boolean budgetSection,
                     int headerLines, int[] sectionSkips, int initialConditionSkip,
                     Function<SimulationFiles, Path> componentFile,
                     Function<SimulationFiles, Path> areaFile) {
        this.description = description;
        this.cropCountFirst = cropCountFirst;
        this.fixedCrops = fixedCrops;
        this.budgetSection = budgetSection;
        this.headerLines = headerLines;
        this.sectionSkips = sectionSkips;
        this.initialConditionSkip = initialConditionSkip;
        this.componentFile = componentFile;
        this.areaFile = areaFile;
    }

    public Path componentFile(SimulationFiles submodel) {
        return componentFile.apply(submodel);
    }

    public Path areaFile(SimulationFiles submodel) {
        return areaFile.apply(submodel);
    }
}
