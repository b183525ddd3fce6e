package footprint.tools.geometry;

import java.util.ArrayList;
import java.util.List;

/**
 * Drawing instruction attached to each path vertex
 **/
public enum PathCode {
    MOVE,
    LINE,
    CLOSE;

    /**
     * Splits a code sequence in runs, each one starting with a MOVE code
     *
     * @param codes the path codes
     * @return a list of {start, end} index pairs, end exclusive
     **/
    static List<int[]> runs(PathCode[] codes) {

        List<int[]> runs = new ArrayList<>();
        int start = 0;
        for (int i = 1; i < codes.length; i++) {
            if (codes[i] == MOVE) {
                runs.add(new int[]{start, i});
                start = i;
            }
        }
        if (codes.length > 0) {
            runs.add(new int[]{start, codes.length});
        }
        return runs;

    }

    /**
     * Codes of a single closed polygon: MOVE, LINE..., CLOSE
     **/
    public static PathCode[] polygon(int size) {

        PathCode[] codes = new PathCode[size];
        for (int i = 0; i < size; i++) {
            codes[i] = LINE;
        }
        codes[0] = MOVE;
        codes[size - 1] = CLOSE;
        return codes;

    }

}
