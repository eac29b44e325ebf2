package iwfmsubmodel.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.nio.file.Path;

/**
 * Manifiesto de la simulación. En el modelo original solo se conocen los ficheros que
 * nombra el fichero principal; los hijos (condiciones de contorno, bombeo, ficheros de
 * cultivos...) se resuelven al leer su fichero padre. Para el submodelo todos los nombres
 * se generan de antemano.
 */
@Value
@Builder
@With
public class SimulationFiles {

    Path mainFile;
    Path preprocessorBinary;

    Path groundwaterFile;
    Path boundaryConditionFile;
    Path specifiedFlowFile;
    Path specifiedHeadFile;
    Path generalHeadFile;
    Path constrainedGeneralHeadFile;
    Path tileDrainFile;
    Path pumpingFile;
    Path wellSpecFile;
    Path elementPumpingFile;
    Path subsidenceFile;

    Path streamFile;
    Path streamInflowFile;
    Path bypassFile;

    Path lakeFile;

    Path rootZoneFile;
    Path nonPondedCropFile;
    Path pondedCropFile;
    Path urbanFile;
    Path nativeVegetationFile;
    Path nonPondedAreaFile;
    Path pondedAreaFile;
    Path urbanAreaFile;
    Path nativeVegetationAreaFile;

    Path smallWatershedFile;
    Path unsaturatedZoneFile;

    /**
     * Nombres de los ficheros del submodelo para una ruta base.
     */
    public static SimulationFiles forSubmodel(ExtractionConfig config) {
        return SimulationFiles.builder()
                .mainFile(config.outputFile("_Simulation.in"))
                .preprocessorBinary(config.outputFile("_Preprocessor.bin"))
                .groundwaterFile(config.componentFile("Groundwater"))
                .boundaryConditionFile(config.componentFile("BC"))
                .specifiedFlowFile(config.componentFile("SpecFlowBC"))
                .specifiedHeadFile(config.componentFile("SpecHeadBC"))
                .generalHeadFile(config.componentFile("GenHeadBC"))
                .constrainedGeneralHeadFile(config.componentFile("ConstGenHeadBC"))
                .tileDrainFile(config.componentFile("TileDrain"))
                .pumpingFile(config.componentFile("Pumping"))
                .wellSpecFile(config.componentFile("WellSpec"))
                .elementPumpingFile(config.componentFile("ElemPump"))
                .subsidenceFile(config.componentFile("Subsidence"))
                .streamFile(config.componentFile("Streams"))
                .streamInflowFile(config.componentFile("StreamInflow"))
                .bypassFile(config.componentFile("Bypass"))
                .rootZoneFile(config.componentFile("RootZone"))
                .nonPondedCropFile(config.componentFile("NonPondedCrops"))
                .pondedCropFile(config.componentFile("PondedCrops"))
                .urbanFile(config.componentFile("Urban"))
                .nativeVegetationFile(config.componentFile("NativeVeg"))
                .nonPondedAreaFile(config.componentFile("NPArea"))
                .pondedAreaFile(config.componentFile("PCArea"))
                .urbanAreaFile(config.componentFile("UrbanArea"))
                .nativeVegetationAreaFile(config.componentFile("NVArea"))
                .smallWatershedFile(config.componentFile("SmallWatersheds"))
                .unsaturatedZoneFile(config.componentFile("Unsat"))
                .build();
    }
}
