package util.serialization;

import java.io.Writer;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Implementing classes can report their state via JSON (JavaScript Object
 * Notation), e.g. the statistics of a call cache after an analysis run
 */
public interface JSONSerializable {

    /**
     * Create a JSON object from this Java object
     * 
     * @return The JSON object corresponding to <code>this</code>
     */
    public JSONObject toJSON();

    /**
     * Write the JSON form of this object to out, see {@link #toJSON()}
     * 
     * @param out
     *            writer to write to
     * @throws JSONException
     *             error writing to JSON, including I/O errors of the writer
     */
    public void writeJSON(Writer out) throws JSONException;

}
