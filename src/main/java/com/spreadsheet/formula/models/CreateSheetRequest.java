package com.spreadsheet.formula.models;

/**
 * JSON body of POST /sheet: { "name": "Budget", "rows": 200, "cols": 10 }.
 * Missing bounds fall back to the configured defaults.
 */
public class CreateSheetRequest {
    private String name;
    private Integer rows;
    private Integer cols;

    // Default constructor needed for JSON (de)serialization
    public CreateSheetRequest() {
    }

    public CreateSheetRequest(String name, Integer rows, Integer cols) {
        this.name = name;
        this.rows = rows;
        this.cols = cols;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Integer getRows() {
        return rows;
    }

    public void setRows(Integer rows) {
        this.rows = rows;
    }

    public Integer getCols() {
        return cols;
    }

    public void setCols(Integer cols) {
        this.cols = cols;
    }
}
