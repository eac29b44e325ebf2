package iwfmsubmodel.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializa y deserializa objetos a ficheros JSON con Jackson.
 * <p>
 * Se usa para los artefactos intermedios de la extracción (listas de identificadores,
 * coordenadas, correspondencias) que la extracción de la simulación vuelve a leer.
 */
@Slf4j
public class JsonFileHandler {

    // El ObjectMapper es costoso de crear y es thread-safe: uno para toda la aplicación.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Los records exponen métodos derivados (isTriangle...) que no son componentes.
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, será sobrescrito.
     *
     * @param data     el objeto a serializar. No puede ser nulo.
     * @param filePath ruta del archivo de destino.
     * @param <T>      tipo del objeto.
     * @throws IOException si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, Path filePath) throws IOException {
        log.info("Serializando {} a archivo: {}", data.getClass().getSimpleName(), filePath.toAbsolutePath());

        try {
            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(filePath.toFile(), data);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON a un objeto del tipo indicado.
     *
     * @throws IOException si el archivo no existe o no se puede leer o interpretar.
     */
    public <T> T readFromFile(Path filePath, Class<T> objectType) throws IOException {
        log.info("Deserializando archivo {} a {}", filePath.toAbsolutePath(), objectType.getSimpleName());
        requireFile(filePath);
        try {
            return objectMapper.readValue(filePath.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Variante para tipos genéricos (listas, conjuntos, mapas).
     */
    public <T> T readFromFile(Path filePath, TypeReference<T> objectType) throws IOException {
        log.info("Deserializando archivo {} a {}", filePath.toAbsolutePath(), objectType.getType().getTypeName());
        requireFile(filePath);
        try {
            return objectMapper.readValue(filePath.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }

    private static void requireFile(Path filePath) throws IOException {
        if (!Files.exists(filePath)) {
            throw new IOException("El archivo especificado no existe: " + filePath.toAbsolutePath());
        }
    }
}
