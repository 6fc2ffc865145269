/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.escheat.mailing.classify;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Place names used as country evidence in free-text city fields.
 */
final class PlaceNames {

    static final List<String> CANADA = List.of(
            "Canada", "Alberta", "Calgary", "Edmonton", "Strathcona County",
            "British Columbia", "Vancouver", "Surrey", "Burnaby", "Manitoba",
            "Winnipeg", "Brandon", "Springfield", "New Brunswick", "Moncton",
            "Saint John", "Fredericton", "Newfoundland and Labrador", "St. John's",
            "Conception Bay South", "Mount Pearl", "Northwest Territories", "Yellowknife",
            "Hay River", "Inuvik", "Nova Scotia", "Halifax", "Sydney", "Lunenburg",
            "Nunavut", "Iqaluit", "Arviat", "Rankin Inlet", "Ontario", "Toronto",
            "Ottawa", "Mississauga", "Prince Edward Island", "Charlottetown",
            "Summerside", "Stratford", "Quebec", "Montreal", "Quebec City", "Laval",
            "Saskatchewan", "Saskatoon", "Regina", "Prince Albert", "Yukon",
            "Whitehorse", "Dawson City", "Faro"
    );

    static final List<String> MEXICO = List.of(
            // states
            "Chihuahua", "Sonora", "Coahuila", "Durango", "Oaxaca", "Tamaulipas", "Jalisco",
            "Zacatecas", "Baja California Sur", "Chiapas", "Veracruz", "Baja California",
            "Nuevo Leon", "Guerrero", "San Luis Potosi", "Michoacan", "Sinaloa", "Campeche",
            "Quintana Roo", "Yucatan", "Puebla", "Guanajuato", "Nayarit", "Tabasco", "Mexico",
            "Hidalgo", "Queretaro", "Colima", "Aguascalientes", "Morelos", "Tlaxcala",
            // cities
            "Ciudad de Mexico", "Mexico City", "Ecatepec", "Guadalajara", "Juarez", "Tijuana",
            "Leon", "Monterrey", "Zapopan", "Nezahualcoyotl", "Culiacan", "Naucalpan", "Merida",
            "Hermosillo", "Saltillo", "Mexicali", "Guadalupe", "Acapulco", "Tlalnepantla",
            "Cancun", "Chimalhuacan", "Torreon", "Morelia", "Reynosa", "Tlaquepaque",
            "Tuxtla Gutierrez", "Toluca", "Ciudad Lopez Mateos", "Cuautitlan Izcalli",
            "Ciudad Apodaca", "Matamoros", "San Nicolas de los Garza", "Xalapa", "Tonala",
            "Mazatlan", "Irapuato", "Nuevo Laredo", "Xico", "Villahermosa", "General Escobedo",
            "Celaya", "Cuernavaca", "Tepic", "Ixtapaluca", "Ciudad Victoria", "Ciudad Obregon",
            "Tampico", "Ciudad Nicolas Romero", "Ensenada", "Coacalco de Berriozabal",
            "Santa Catarina", "Uruapan", "Gomez Palacio", "Los Mochis", "Pachuca",
            "Soledad de Graciano Sanchez", "Tehuacan", "Ojo de Agua", "Coatzacoalcos",
            "Monclova", "La Paz", "Nogales", "Buenavista", "Puerto Vallarta", "Tapachula",
            "Ciudad Madero", "San Pablo de las Salinas", "Chilpancingo", "Poza Rica",
            "Chicoloapan de Juarez", "Ciudad del Carmen", "Chalco de Diaz Covarrubias",
            "Jiutepec", "Salamanca", "San Luis Rio Colorado", "Cuautla", "Ciudad Benito Juarez",
            "Chetumal", "Piedras Negras", "Playa del Carmen", "Zamora", "Cordoba",
            "San Juan del Rio", "Ciudad Acuna", "Manzanillo", "Ciudad Valles",
            "San Pedro Garza Garcia", "Fresnillo", "Orizaba", "Miramar", "Iguala", "Delicias",
            "Ciudad de Villa de alvarez", "Ciudad Cuauhtemoc", "Navojoa", "Guaymas",
            "Minatitlan", "Cuautitlan", "Texcoco", "Hidalgo del Parral", "Tepexpan", "Tulancingo"
    );

    private PlaceNames() {}

    /**
     * Case-insensitive alternation that matches any of the names as whole words.
     */
    static Pattern wholeWords(List<String> names) {
        String alternation = names.stream()
                .map(name -> "\\b" + Pattern.quote(name) + "\\b")
                .collect(Collectors.joining("|"));
        return Pattern.compile(alternation, Pattern.CASE_INSENSITIVE);
    }
}
